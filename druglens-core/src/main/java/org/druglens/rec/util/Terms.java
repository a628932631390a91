package org.druglens.rec.util;

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

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * String helpers for drug, condition and symptom terms.
 */
public final class Terms {

	private Terms() {
	}

	/** Lowercase + trim; null becomes "". */
	public static String normalize(String s) {
		return StringUtils.trimToEmpty(s).toLowerCase(Locale.ROOT);
	}

	/**
	 * Symmetric substring containment on normalized terms. Blank terms never
	 * overlap anything.
	 */
	public static boolean overlaps(String a, String b) {
		String x = normalize(a);
		String y = normalize(b);
		if (x.isEmpty() || y.isEmpty()) {
			return false;
		}
		return x.contains(y) || y.contains(x);
	}

	/**
	 * Upper-cases the first letter of every run of letters and lower-cases the
	 * rest: "ortho-tri-cyclen" becomes "Ortho-Tri-Cyclen".
	 */
	public static String titleCase(String s) {
		if (StringUtils.isEmpty(s)) {
			return s;
		}
		StringBuilder sb = new StringBuilder(s.length());
		boolean inWord = false;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (Character.isLetter(c)) {
				sb.append(inWord ? Character.toLowerCase(c) : Character.toUpperCase(c));
				inWord = true;
			} else {
				sb.append(c);
				inWord = false;
			}
		}
		return sb.toString();
	}

	/** Half-up rounding to the given number of decimals. */
	public static double round(double value, int decimals) {
		double scale = Math.pow(10, decimals);
		return Math.round(value * scale) / scale;
	}
}
