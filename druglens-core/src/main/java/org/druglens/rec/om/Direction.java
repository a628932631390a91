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

/**
 * Whether an explanation factor pushes towards or away from a recommendation.
 */
public enum Direction {
	POSITIVE("positive"), NEGATIVE("negative");

	private final String label;

	Direction(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	/** Positive iff the signed value is strictly greater than zero. */
	public static Direction of(double signedValue) {
		return signedValue > 0 ? POSITIVE : NEGATIVE;
	}

	public static Direction of(boolean positive) {
		return positive ? POSITIVE : NEGATIVE;
	}

	@Override
	public String toString() {
		return label;
	}
}
