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

import java.util.ArrayList;
import java.util.List;

import org.druglens.rec.om.Explanation;
import org.druglens.rec.util.Terms;

/**
 * Final assembly of the explanation list: sort by influence, keep the top
 * {@value #MAX_EXPLANATIONS}, and rescale the kept entries to sum to 100 at one
 * decimal. The rounding residual goes to the largest entry so the rounded
 * values add up to exactly 100.0.
 * <p>
 * When the total influence is 0 the entries are returned unscaled.
 */
public final class ExplanationNormalizer {

	public static final int MAX_EXPLANATIONS = 6;

	private ExplanationNormalizer() {
	}

	public static List<Explanation> normalize(List<Explanation> explanations) {
		List<Explanation> sorted = new ArrayList<>(explanations);
		sorted.sort(AttributionEngine.byInfluenceDescending());
		List<Explanation> kept = new ArrayList<>(sorted.subList(0, Math.min(MAX_EXPLANATIONS, sorted.size())));

		double total = 0.0;
		for (Explanation e : kept) {
			total += e.getInfluence();
		}
		if (total <= 0.0) {
			return kept;
		}

		List<Explanation> scaled = new ArrayList<>(kept.size());
		double roundedSum = 0.0;
		for (Explanation e : kept) {
			double v = Terms.round(e.getInfluence() / total * 100.0, 1);
			roundedSum += v;
			scaled.add(e.withInfluence(v));
		}

		double residual = Terms.round(100.0 - roundedSum, 1);
		if (residual != 0.0) {
			Explanation top = scaled.get(0);
			scaled.set(0, top.withInfluence(Terms.round(top.getInfluence() + residual, 1)));
			scaled.sort(AttributionEngine.byInfluenceDescending());
		}
		return scaled;
	}
}
