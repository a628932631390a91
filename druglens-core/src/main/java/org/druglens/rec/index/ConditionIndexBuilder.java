package org.druglens.rec.index;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.druglens.rec.om.ConditionDrugStats;
import org.druglens.rec.om.DrugInfo;
import org.druglens.rec.om.ReviewRecord;
import org.druglens.rec.util.Logger;
import org.druglens.rec.util.Terms;

/**
 * Aggregates raw review records into a {@link ConditionIndex}.
 * <p>
 * Condition and drug names are lowercased and trimmed. Records missing a
 * condition, drug or effectiveness label are discarded. A missing rating
 * counts as {@value #DEFAULT_RATING}. Not thread-safe; build once, then share
 * the resulting index.
 */
public class ConditionIndexBuilder {

	/** Rating assumed when a review carries none. */
	public static final double DEFAULT_RATING = 5.0;

	private final Map<String, Map<String, Accumulator>> byCondition = new LinkedHashMap<>();
	private final Map<String, DrugInfo> drugInfo = new LinkedHashMap<>();

	private int accepted = 0;
	private int discarded = 0;

	/** Convenience: index a whole collection in one call. */
	public static ConditionIndex fromRecords(Iterable<ReviewRecord> records) {
		ConditionIndexBuilder builder = new ConditionIndexBuilder();
		for (ReviewRecord r : records) {
			builder.add(r);
		}
		return builder.build();
	}

	/**
	 * Add one record.
	 *
	 * @return true if the record was indexed, false if it was discarded
	 */
	public boolean add(ReviewRecord record) {
		if (record == null || StringUtils.isBlank(record.getCondition()) || StringUtils.isBlank(record.getDrugName())
				|| StringUtils.isBlank(record.getEffectiveness())) {
			discarded++;
			return false;
		}

		String condition = Terms.normalize(record.getCondition());
		String drug = Terms.normalize(record.getDrugName());

		Accumulator acc = byCondition.computeIfAbsent(condition, k -> new LinkedHashMap<>())
				.computeIfAbsent(drug, k -> new Accumulator());

		double rating = record.getRating() == null || record.getRating().isNaN() ? DEFAULT_RATING : record.getRating();
		acc.ratings.add(rating);
		acc.effectiveness.add(OrdinalScales.effectivenessOrdinal(record.getEffectiveness()));
		acc.sideEffects.add(OrdinalScales.sideEffectOrdinal(record.getSideEffects()));

		drugInfo.computeIfAbsent(drug, k -> new DrugInfo(
				StringUtils.defaultIfBlank(record.getEffectiveness(), DrugInfo.UNKNOWN),
				StringUtils.defaultIfBlank(record.getSideEffects(), DrugInfo.UNKNOWN),
				StringUtils.defaultString(record.getBenefitsReview()),
				StringUtils.defaultString(record.getSideEffectsReview()),
				StringUtils.defaultString(record.getCommentsReview())));

		accepted++;
		return true;
	}

	public int getAccepted() {
		return accepted;
	}

	public int getDiscarded() {
		return discarded;
	}

	/** Freeze the accumulated statistics. */
	public ConditionIndex build() {
		Map<String, Map<String, ConditionDrugStats>> stats = new LinkedHashMap<>();
		for (Map.Entry<String, Map<String, Accumulator>> c : byCondition.entrySet()) {
			Map<String, ConditionDrugStats> drugs = new LinkedHashMap<>();
			for (Map.Entry<String, Accumulator> d : c.getValue().entrySet()) {
				Accumulator a = d.getValue();
				drugs.put(d.getKey(), new ConditionDrugStats(c.getKey(), d.getKey(), a.ratings, a.effectiveness,
						a.sideEffects));
			}
			stats.put(c.getKey(), drugs);
		}
		ConditionIndex index = new ConditionIndex(stats, drugInfo);
		Logger.info("Condition index built: conditions={}, aggregates={}, drugs={}, records={}, discarded={}",
				index.getConditions().size(), index.size(), drugInfo.size(), accepted, discarded);
		return index;
	}

	private static final class Accumulator {
		final List<Double> ratings = new ArrayList<>();
		final List<Integer> effectiveness = new ArrayList<>();
		final List<Integer> sideEffects = new ArrayList<>();
	}
}
