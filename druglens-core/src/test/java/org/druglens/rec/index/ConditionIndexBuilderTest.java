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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.druglens.rec.om.ConditionDrugStats;
import org.druglens.rec.om.DrugInfo;
import org.druglens.rec.om.ReviewRecord;
import org.junit.jupiter.api.Test;

class ConditionIndexBuilderTest {

	private static ReviewRecord review(String drug, String condition, Double rating, String eff, String se) {
		return new ReviewRecord(drug, condition, rating, eff, se);
	}

	@Test
	void aggregates_reviews_under_normalized_keys() {
		ConditionIndexBuilder b = new ConditionIndexBuilder();
		assertTrue(b.add(review("Tamiflu", "Flu", 8.0, "Highly Effective", "Mild Side Effects")));
		assertTrue(b.add(review(" tamiflu ", "FLU ", 10.0, "Considerably Effective", "No Side Effects")));
		ConditionIndex index = b.build();

		ConditionDrugStats s = index.getStats("flu", "tamiflu").orElseThrow();
		assertEquals(List.of(8.0, 10.0), s.getRatings());
		assertEquals(List.of(5, 4), s.getEffectivenessScores());
		assertEquals(List.of(2, 1), s.getSideEffectScores());
		assertEquals(9.0, s.getAvgRating(), 1e-9);
		assertEquals(2, s.getReviewCount());
		assertEquals(1, index.size());
	}

	@Test
	void records_missing_key_fields_are_discarded() {
		ConditionIndexBuilder b = new ConditionIndexBuilder();
		assertFalse(b.add(review("aspirin", "", 6.0, "Moderately Effective", null)));
		assertFalse(b.add(review(null, "pain", 6.0, "Moderately Effective", null)));
		assertFalse(b.add(review("aspirin", "pain", 6.0, "  ", null)));
		assertFalse(b.add(null));
		assertTrue(b.add(review("aspirin", "pain", 6.0, "Moderately Effective", null)));

		assertEquals(1, b.getAccepted());
		assertEquals(4, b.getDiscarded());
		assertEquals(1, b.build().size());
	}

	@Test
	void missing_rating_and_side_effects_use_defaults() {
		ConditionIndex index = ConditionIndexBuilder.fromRecords(
				List.of(review("prilosec", "acid reflux", null, "Marginally Effective", null)));

		ConditionDrugStats s = index.getStats("acid reflux", "prilosec").orElseThrow();
		assertEquals(ConditionIndexBuilder.DEFAULT_RATING, s.getAvgRating(), 1e-9);
		assertEquals(OrdinalScales.DEFAULT_SIDE_EFFECTS, s.getAvgSideEffects(), 1e-9);
	}

	@Test
	void drug_info_comes_from_first_accepted_record() {
		ReviewRecord first = review("ponstel", "menstrual cramps", 10.0, "Highly Effective", null);
		first.setBenefitsReview("stopped the cramps");
		ReviewRecord second = review("Ponstel", "cramps", 2.0, "Ineffective", "Severe Side Effects");
		second.setBenefitsReview("nothing");

		ConditionIndex index = ConditionIndexBuilder.fromRecords(List.of(first, second));

		DrugInfo info = index.getDrugInfo("ponstel").orElseThrow();
		assertEquals("Highly Effective", info.getEffectiveness());
		assertEquals(DrugInfo.UNKNOWN, info.getSideEffects());
		assertEquals("stopped the cramps", info.getBenefitsReview());
		assertEquals("", info.getCommentsReview());
		assertEquals(2, index.size());
		assertEquals(List.of("ponstel"), List.copyOf(index.getDrugInfo().keySet()));
	}

	@Test
	void index_preserves_first_seen_order_and_is_read_only() {
		ConditionIndex index = ConditionIndexBuilder.fromRecords(List.of(
				review("b", "pain", 5.0, "Moderately Effective", null),
				review("a", "flu", 5.0, "Moderately Effective", null),
				review("c", "pain", 5.0, "Moderately Effective", null)));

		assertEquals(List.of("pain", "flu"), List.copyOf(index.getConditions()));
		assertEquals(List.of("b", "c"), List.copyOf(index.getDrugs("pain").keySet()));
		assertTrue(index.getDrugs("unknown").isEmpty());
		assertThrows(UnsupportedOperationException.class, () -> index.getDrugs("pain").clear());
		assertEquals(3, index.allStats().size());
	}

	@Test
	void empty_index_has_no_entries() {
		assertTrue(ConditionIndex.empty().isEmpty());
		assertTrue(ConditionIndexBuilder.fromRecords(List.of()).isEmpty());
	}
}
