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

/**
 * A trained binary classifier that can attribute its output to input features.
 * Implementations must be safe for concurrent reads.
 */
public interface AttributionModel {

	/**
	 * Signed per-feature attribution for a {@link FeatureVector}; positive
	 * values push towards the "good drug" class.
	 *
	 * @return array of length {@link FeatureVector#SIZE}
	 */
	double[] explain(double[] features);

	/** Probability of the "good drug" class. */
	double probability(double[] features);
}
