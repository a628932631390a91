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
 * Descriptive labels and review snippets for a drug, taken from the first
 * review seen for it.
 */
@Value
public class DrugInfo {

	public static final String UNKNOWN = "Unknown";

	String effectiveness;
	String sideEffects;
	String benefitsReview;
	String sideEffectsReview;
	String commentsReview;
}
