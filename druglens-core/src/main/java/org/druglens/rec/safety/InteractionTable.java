package org.druglens.rec.safety;

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

/**
 * Known medication → conflicting substances/classes. Lowercase throughout.
 */
public final class InteractionTable {

	private static final Map<String, List<String>> TABLE;

	static {
		Map<String, List<String>> m = new LinkedHashMap<>();
		m.put("warfarin", List.of("aspirin", "ibuprofen", "naproxen"));
		m.put("metformin", List.of("contrast dye"));
		m.put("lisinopril", List.of("potassium", "nsaids"));
		m.put("simvastatin", List.of("grapefruit", "erythromycin"));
		m.put("sertraline", List.of("tramadol", "triptans"));
		m.put("omeprazole", List.of("clopidogrel"));
		TABLE = Collections.unmodifiableMap(m);
	}

	private InteractionTable() {
	}

	public static Map<String, List<String>> entries() {
		return TABLE;
	}

	/** Conflicts for a known medication; empty when the name is not a key. */
	public static List<String> conflictsOf(String medication) {
		return TABLE.getOrDefault(medication, Collections.emptyList());
	}
}
