package org.druglens.rec.dosage;

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

import org.druglens.rec.om.DosageRecommendation;

/**
 * Dosage text from age and heart-rate bands.
 * <p>
 * The dose itself is a fixed {@value #DEFAULT_DOSAGE} regardless of the age
 * modifier; the modifier is reported alongside but not applied.
 */
public class DosageRuleEngine {

	public static final String DEFAULT_DOSAGE = "500mg";

	public DosageRecommendation recommend(int age, int heartRate) {
		double modifier;
		String frequency;
		if (age < 18) {
			modifier = 0.5;
			frequency = "Every 6-8 hours";
		} else if (age > 65) {
			modifier = 0.75;
			frequency = "Every 8-12 hours";
		} else {
			modifier = 1.0;
			frequency = "Every 6 hours as needed";
		}

		if (heartRate > 100) {
			frequency += " (monitor heart rate)";
		} else if (heartRate < 60) {
			frequency += " (bradycardia noted)";
		}
		return new DosageRecommendation(DEFAULT_DOSAGE, frequency, modifier);
	}
}
