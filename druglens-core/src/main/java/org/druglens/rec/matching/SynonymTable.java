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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static mapping from a normalized symptom or history term to the condition
 * keywords it suggests. Keys are lowercase; value order is preserved.
 */
public final class SynonymTable {

	private static final Map<String, List<String>> TABLE;

	static {
		Map<String, List<String>> m = new LinkedHashMap<>();
		m.put("fever", List.of("infection", "flu", "cold", "virus"));
		m.put("cough", List.of("cold", "flu", "bronchitis", "asthma", "infection"));
		m.put("headache", List.of("migraine", "tension headache", "pain", "headache"));
		m.put("fatigue", List.of("depression", "chronic fatigue", "anemia"));
		m.put("nausea", List.of("nausea", "vomiting", "morning sickness", "motion sickness"));
		m.put("dizziness", List.of("vertigo", "dizziness", "hypertension"));
		m.put("chest pain", List.of("angina", "heart", "cardiac"));
		m.put("shortness of breath", List.of("asthma", "copd", "bronchitis", "heart failure"));
		m.put("joint pain", List.of("arthritis", "pain", "inflammation"));
		m.put("muscle aches", List.of("pain", "fibromyalgia", "muscle"));
		m.put("sore throat", List.of("infection", "strep", "pharyngitis", "throat"));
		m.put("runny nose", List.of("cold", "allergy", "rhinitis", "sinusitis"));
		m.put("diabetes", List.of("diabetes", "blood sugar"));
		m.put("hypertension", List.of("hypertension", "high blood pressure", "blood pressure"));
		m.put("asthma", List.of("asthma", "breathing", "bronchial"));
		m.put("heart disease", List.of("heart", "cardiac", "cardiovascular"));
		m.put("depression", List.of("depression", "mood", "mental"));
		m.put("anxiety", List.of("anxiety", "panic", "stress"));
		TABLE = Collections.unmodifiableMap(m);
	}

	private SynonymTable() {
	}

	/** Condition keywords for a normalized term; empty when the term is unknown. */
	public static List<String> lookup(String normalizedTerm) {
		return TABLE.getOrDefault(normalizedTerm, Collections.emptyList());
	}

	public static Set<String> terms() {
		return TABLE.keySet();
	}
}
