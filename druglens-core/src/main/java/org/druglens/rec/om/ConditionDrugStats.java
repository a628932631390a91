package org.druglens.rec.om;

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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Aggregated review statistics for one (condition, drug) pair. Built once by
 * the index builder and read-only afterwards; means are computed up front.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class ConditionDrugStats {

	@ToString.Include
	@EqualsAndHashCode.Include
	private final String condition;

	@ToString.Include
	@EqualsAndHashCode.Include
	private final String drug;

	private final List<Double> ratings;
	private final List<Integer> effectivenessScores;
	private final List<Integer> sideEffectScores;

	@ToString.Include
	private final double avgRating;
	@ToString.Include
	private final double avgEffectiveness;
	@ToString.Include
	private final double avgSideEffects;

	public ConditionDrugStats(String condition, String drug, List<Double> ratings, List<Integer> effectivenessScores,
			List<Integer> sideEffectScores) {
		if (ratings.size() != effectivenessScores.size() || ratings.size() != sideEffectScores.size()) {
			throw new IllegalArgumentException("Score lists differ in length for " + condition + "/" + drug);
		}
		this.condition = condition;
		this.drug = drug;
		this.ratings = List.copyOf(ratings);
		this.effectivenessScores = List.copyOf(effectivenessScores);
		this.sideEffectScores = List.copyOf(sideEffectScores);
		this.avgRating = mean(this.ratings);
		this.avgEffectiveness = mean(this.effectivenessScores);
		this.avgSideEffects = mean(this.sideEffectScores);
	}

	/** Number of reviews aggregated into this entry. */
	@ToString.Include
	public int getReviewCount() {
		return ratings.size();
	}

	/** Review count bounded by {@code cap}, used wherever the count is a feature. */
	public int getReviewCount(int cap) {
		return Math.min(getReviewCount(), cap);
	}

	private static double mean(List<? extends Number> values) {
		if (values.isEmpty()) {
			return 0.0;
		}
		double sum = 0.0;
		for (Number n : values) {
			sum += n.doubleValue();
		}
		return sum / values.size();
	}
}
