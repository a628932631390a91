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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class PatientProfileTest {

	@Test
	void builder_copies_collections_in_order_and_drops_nulls() {
		List<String> symptoms = new ArrayList<>(Arrays.asList("fever", null, "cough", "fever"));
		PatientProfile p = PatientProfile.builder().age(40).heartRate(80).symptoms(symptoms).build();

		symptoms.add("nausea");

		assertEquals(List.of("fever", "cough"), List.copyOf(p.getSymptoms()));
		assertThrows(UnsupportedOperationException.class, () -> p.getSymptoms().add("x"));
	}

	@Test
	void nulls_become_empty_values() {
		PatientProfile p = PatientProfile.builder().age(40).heartRate(80).build();

		assertEquals("", p.getGender());
		assertEquals("", p.getBloodType());
		assertEquals("", p.getCurrentMedications());
		assertTrue(p.getAllergies().isEmpty());
		assertTrue(p.getMedicalHistory().isEmpty());
	}

	@Test
	void stats_precompute_means_and_cap_counts() {
		ConditionDrugStats s = new ConditionDrugStats("flu", "tamiflu", List.of(8.0, 10.0), List.of(5, 4),
				List.of(2, 1));

		assertEquals(9.0, s.getAvgRating(), 1e-9);
		assertEquals(4.5, s.getAvgEffectiveness(), 1e-9);
		assertEquals(1.5, s.getAvgSideEffects(), 1e-9);
		assertEquals(2, s.getReviewCount());
		assertEquals(1, s.getReviewCount(1));
	}

	@Test
	void stats_reject_misaligned_score_lists() {
		assertThrows(IllegalArgumentException.class,
				() -> new ConditionDrugStats("flu", "tamiflu", List.of(8.0), List.of(5, 4), List.of(2)));
	}
}
