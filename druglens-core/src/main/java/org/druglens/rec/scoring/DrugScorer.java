package org.druglens.rec.scoring;

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
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.druglens.rec.index.ConditionIndex;
import org.druglens.rec.om.ConditionDrugStats;
import org.druglens.rec.om.ScoredCandidate;
import org.druglens.rec.util.Logger;
import org.druglens.rec.util.Terms;

/**
 * Scores every drug reachable from the matched conditions and returns the
 * best {@value #MAX_CANDIDATES}.
 * <p>
 * Index conditions are reached by symmetric substring containment, so
 * "pain" reaches "back pain" and "migraine headache" reaches "migraine".
 * A drug reached through several conditions keeps its highest score. Equal
 * scores keep first-insertion order (the sort is stable); there is no
 * secondary key.
 */
public class DrugScorer {

	public static final int MAX_CANDIDATES = 5;

	/** Review count cap applied inside the composite score. */
	public static final int SCORE_REVIEW_CAP = 20;

	private final ConditionIndex index;

	public DrugScorer(ConditionIndex index) {
		this.index = index;
	}

	/**
	 * avg_rating*0.3 + avg_effectiveness*2.0 - avg_side_effects*0.5
	 * + min(review_count, 20)*0.1
	 */
	public static double score(ConditionDrugStats s) {
		return s.getAvgRating() * 0.3
				+ s.getAvgEffectiveness() * 2.0
				- s.getAvgSideEffects() * 0.5
				+ s.getReviewCount(SCORE_REVIEW_CAP) * 0.1;
	}

	public List<ScoredCandidate> rank(Collection<String> matchedConditions) {
		Map<String, ScoredCandidate> best = new LinkedHashMap<>();

		for (String matched : matchedConditions) {
			for (String dbCondition : index.getConditions()) {
				if (!Terms.overlaps(matched, dbCondition)) {
					continue;
				}
				for (ConditionDrugStats stats : index.getDrugs(dbCondition).values()) {
					double score = score(stats);
					ScoredCandidate prev = best.get(stats.getDrug());
					if (prev == null || score > prev.getScore()) {
						best.put(stats.getDrug(), new ScoredCandidate(stats.getDrug(), score, stats, dbCondition));
					}
				}
			}
		}

		List<ScoredCandidate> ranked = new ArrayList<>(best.values());
		ranked.sort(Comparator.comparingDouble(ScoredCandidate::getScore).reversed());
		if (Logger.isEnabled(Logger.Level.DEBUG)) {
			Logger.debug("Scored {} candidate drug(s) for conditions {}", ranked.size(), matchedConditions);
		}
		return ranked.size() > MAX_CANDIDATES ? new ArrayList<>(ranked.subList(0, MAX_CANDIDATES)) : ranked;
	}
}
