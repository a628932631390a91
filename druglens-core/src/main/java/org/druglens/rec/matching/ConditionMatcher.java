package org.druglens.rec.matching;

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.druglens.rec.util.Terms;

/**
 * Maps patient symptom and history terms to condition keywords through the
 * {@link SynonymTable}. Matching is exact on the lowercased, trimmed term; no
 * fuzzy matching happens here.
 */
public class ConditionMatcher {

	/** Used by callers when nothing matches, so scoring always has input. */
	public static final Set<String> DEFAULT_CONDITIONS = Collections
			.unmodifiableSet(new LinkedHashSet<>(List.of("general", "pain", "infection")));

	/**
	 * @return condition keywords in first-seen order (symptoms, then history);
	 *         empty when no term is in the table
	 */
	public Set<String> match(Collection<String> symptoms, Collection<String> medicalHistory) {
		Set<String> matched = new LinkedHashSet<>();
		addMatches(symptoms, matched);
		addMatches(medicalHistory, matched);
		return Collections.unmodifiableSet(matched);
	}

	/** {@link #match} with {@link #DEFAULT_CONDITIONS} substituted for an empty result. */
	public Set<String> matchOrDefault(Collection<String> symptoms, Collection<String> medicalHistory) {
		Set<String> matched = match(symptoms, medicalHistory);
		return matched.isEmpty() ? DEFAULT_CONDITIONS : matched;
	}

	private static void addMatches(Collection<String> terms, Set<String> out) {
		if (terms == null) {
			return;
		}
		for (String term : terms) {
			out.addAll(SynonymTable.lookup(Terms.normalize(term)));
		}
	}
}
