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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.druglens.rec.om.ConditionDrugStats;
import org.druglens.rec.om.DrugInfo;

/**
 * Immutable condition → drug → statistics index plus per-drug descriptive
 * info. Iteration follows the order in which conditions and drugs were first
 * seen, which is what the ranker's tie-break relies on.
 * <p>
 * Safe to share across threads once constructed.
 */
public final class ConditionIndex {

	private final Map<String, Map<String, ConditionDrugStats>> byCondition;
	private final Map<String, DrugInfo> drugInfo;
	private final int statsCount;

	ConditionIndex(Map<String, Map<String, ConditionDrugStats>> byCondition, Map<String, DrugInfo> drugInfo) {
		Map<String, Map<String, ConditionDrugStats>> copy = new LinkedHashMap<>();
		int count = 0;
		for (Map.Entry<String, Map<String, ConditionDrugStats>> e : byCondition.entrySet()) {
			copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
			count += e.getValue().size();
		}
		this.byCondition = Collections.unmodifiableMap(copy);
		this.drugInfo = Collections.unmodifiableMap(new LinkedHashMap<>(drugInfo));
		this.statsCount = count;
	}

	/** An index with no entries. */
	public static ConditionIndex empty() {
		return new ConditionIndex(Collections.emptyMap(), Collections.emptyMap());
	}

	/** Normalized condition keys in first-seen order. */
	public Set<String> getConditions() {
		return byCondition.keySet();
	}

	/** Drugs recorded for a condition key; empty map when unknown. */
	public Map<String, ConditionDrugStats> getDrugs(String condition) {
		return byCondition.getOrDefault(condition, Collections.emptyMap());
	}

	public Optional<ConditionDrugStats> getStats(String condition, String drug) {
		return Optional.ofNullable(getDrugs(condition).get(drug));
	}

	public Optional<DrugInfo> getDrugInfo(String drug) {
		return Optional.ofNullable(drugInfo.get(drug));
	}

	public Map<String, DrugInfo> getDrugInfo() {
		return drugInfo;
	}

	/** Every (condition, drug) aggregate in index order. */
	public List<ConditionDrugStats> allStats() {
		List<ConditionDrugStats> out = new ArrayList<>(statsCount);
		for (Map<String, ConditionDrugStats> drugs : byCondition.values()) {
			out.addAll(drugs.values());
		}
		return out;
	}

	/** Number of (condition, drug) aggregates. */
	public int size() {
		return statsCount;
	}

	public boolean isEmpty() {
		return statsCount == 0;
	}
}
