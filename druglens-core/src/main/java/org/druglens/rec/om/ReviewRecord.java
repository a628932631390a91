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

import lombok.Data;

/**
 * One raw historical review row (drugLib layout) before indexing.
 */
@Data
public class ReviewRecord {

	private String drugName;
	private String condition;

	/** Patient rating 1-10; null when absent. */
	private Double rating;

	/** Categorical label, e.g. "Highly Effective". */
	private String effectiveness;

	/** Categorical label, e.g. "Mild Side Effects". */
	private String sideEffects;

	private String benefitsReview;
	private String sideEffectsReview;
	private String commentsReview;

	public ReviewRecord() {
	}

	public ReviewRecord(String drugName, String condition, Double rating, String effectiveness, String sideEffects) {
		this.drugName = drugName;
		this.condition = condition;
		this.rating = rating;
		this.effectiveness = effectiveness;
		this.sideEffects = sideEffects;
	}
}
