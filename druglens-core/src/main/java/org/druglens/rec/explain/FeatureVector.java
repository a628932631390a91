package org.druglens.rec.explain;

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

import java.util.List;

import org.druglens.rec.om.ConditionDrugStats;

/**
 * The four-dimensional feature vector shared by classifier training and
 * attribution: [avg_rating, avg_effectiveness, avg_side_effects,
 * min(review_count, 100)].
 */
public final class FeatureVector {

	public static final int SIZE = 4;

	public static final int RATING = 0;
	public static final int EFFECTIVENESS = 1;
	public static final int SIDE_EFFECTS = 2;
	public static final int EVIDENCE = 3;

	/** Caps the influence of heavily reviewed outliers. */
	public static final int REVIEW_COUNT_CAP = 100;

	/** Display names, index-aligned with the vector. */
	public static final List<String> NAMES = List.of("Patient Rating", "Drug Effectiveness", "Side Effect Risk",
			"Clinical Evidence");

	private FeatureVector() {
	}

	public static double[] of(ConditionDrugStats stats) {
		return new double[] { stats.getAvgRating(), stats.getAvgEffectiveness(), stats.getAvgSideEffects(),
				stats.getReviewCount(REVIEW_COUNT_CAP) };
	}

	/** Training label: 1 iff avg_rating ≥ 7 and avg_effectiveness ≥ 4. */
	public static int label(ConditionDrugStats stats) {
		return stats.getAvgRating() >= 7 && stats.getAvgEffectiveness() >= 4 ? 1 : 0;
	}
}
