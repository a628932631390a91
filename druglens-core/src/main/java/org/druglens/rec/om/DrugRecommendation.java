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

import lombok.Value;

/**
 * A recommended drug as returned to the caller.
 */
@Value
public class DrugRecommendation {

	String name;

	/** In [0, 0.95], two decimals. */
	double confidence;

	String dosage;

	/** Age-band scaling of {@link #dosage}: 0.5, 0.75 or 1.0. */
	double doseModifier;

	String frequency;
	String effectiveness;
	String sideEffectsRisk;

	/** Index condition key the drug was reached through. */
	String conditionMatch;
}
