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
 * One "why this drug" factor: a display label, an influence on a 0-100 scale
 * and a direction.
 */
@Value
public class Explanation {

	String feature;
	double influence;
	Direction direction;

	/** Same factor with a different influence. */
	public Explanation withInfluence(double newInfluence) {
		return new Explanation(feature, newInfluence, direction);
	}
}
