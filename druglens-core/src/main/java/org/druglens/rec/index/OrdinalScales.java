package org.druglens.rec.index;

/*
 * This file is part of DrugLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * DrugLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DrugLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DrugLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.lang3.StringUtils;

/**
 * Fixed ordinal scales for the categorical review labels, and the thresholds
 * that turn averaged ordinals back into display labels.
 * <p>
 * Indexing and labeling both go through this class so the two passes always
 * agree on the scale.
 */
public final class OrdinalScales {

	public static final String HIGHLY_EFFECTIVE = "Highly Effective";
	public static final String CONSIDERABLY_EFFECTIVE = "Considerably Effective";
	public static final String MODERATELY_EFFECTIVE = "Moderately Effective";
	public static final String MARGINALLY_EFFECTIVE = "Marginally Effective";
	public static final String INEFFECTIVE = "Ineffective";

	public static final String NO_SIDE_EFFECTS = "No Side Effects";
	public static final String MILD_SIDE_EFFECTS = "Mild Side Effects";
	public static final String MODERATE_SIDE_EFFECTS = "Moderate Side Effects";
	public static final String SEVERE_SIDE_EFFECTS = "Severe Side Effects";
	public static final String EXTREMELY_SEVERE_SIDE_EFFECTS = "Extremely Severe Side Effects";

	public static final String LOW_RISK = "Low Risk";
	public static final String MILD_RISK = "Mild Risk";
	public static final String MODERATE_RISK = "Moderate Risk";
	public static final String HIGH_RISK = "High Risk";

	/** Ordinal used when an effectiveness label is missing or unknown. */
	public static final int DEFAULT_EFFECTIVENESS = 3;

	/** Ordinal used when a side-effect label is missing or unknown. */
	public static final int DEFAULT_SIDE_EFFECTS = 2;

	public static final Map<String, Integer> EFFECTIVENESS;
	public static final Map<String, Integer> SIDE_EFFECTS;

	static {
		Map<String, Integer> eff = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		eff.put(HIGHLY_EFFECTIVE, 5);
		eff.put(CONSIDERABLY_EFFECTIVE, 4);
		eff.put(MODERATELY_EFFECTIVE, 3);
		eff.put(MARGINALLY_EFFECTIVE, 2);
		eff.put(INEFFECTIVE, 1);
		EFFECTIVENESS = Collections.unmodifiableMap(eff);

		Map<String, Integer> se = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		se.put(NO_SIDE_EFFECTS, 1);
		se.put(MILD_SIDE_EFFECTS, 2);
		se.put(MODERATE_SIDE_EFFECTS, 3);
		se.put(SEVERE_SIDE_EFFECTS, 4);
		se.put(EXTREMELY_SEVERE_SIDE_EFFECTS, 5);
		SIDE_EFFECTS = Collections.unmodifiableMap(se);
	}

	private OrdinalScales() {
	}

	/** 1 (Ineffective) .. 5 (Highly Effective); unknown labels map to 3. */
	public static int effectivenessOrdinal(String label) {
		if (StringUtils.isBlank(label)) {
			return DEFAULT_EFFECTIVENESS;
		}
		return EFFECTIVENESS.getOrDefault(label.trim(), DEFAULT_EFFECTIVENESS);
	}

	/** 1 (No Side Effects) .. 5 (Extremely Severe); unknown labels map to 2. */
	public static int sideEffectOrdinal(String label) {
		if (StringUtils.isBlank(label)) {
			return DEFAULT_SIDE_EFFECTS;
		}
		return SIDE_EFFECTS.getOrDefault(label.trim(), DEFAULT_SIDE_EFFECTS);
	}

	/** Display label for an averaged effectiveness ordinal. */
	public static String effectivenessLabel(double avgEffectiveness) {
		if (avgEffectiveness >= 4.5) {
			return HIGHLY_EFFECTIVE;
		} else if (avgEffectiveness >= 3.5) {
			return CONSIDERABLY_EFFECTIVE;
		} else if (avgEffectiveness >= 2.5) {
			return MODERATELY_EFFECTIVE;
		}
		return MARGINALLY_EFFECTIVE;
	}

	/** Display label for an averaged side-effect ordinal. */
	public static String sideEffectRiskLabel(double avgSideEffects) {
		if (avgSideEffects <= 1.5) {
			return LOW_RISK;
		} else if (avgSideEffects <= 2.5) {
			return MILD_RISK;
		} else if (avgSideEffects <= 3.5) {
			return MODERATE_RISK;
		}
		return HIGH_RISK;
	}
}
