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

import org.junit.jupiter.api.Test;

class OrdinalScalesTest {

	@Test
	void effectiveness_labels_map_to_five_point_scale() {
		assertEquals(5, OrdinalScales.effectivenessOrdinal("Highly Effective"));
		assertEquals(4, OrdinalScales.effectivenessOrdinal("considerably effective"));
		assertEquals(1, OrdinalScales.effectivenessOrdinal(" Ineffective "));
	}

	@Test
	void unknown_or_missing_labels_use_defaults() {
		assertEquals(OrdinalScales.DEFAULT_EFFECTIVENESS, OrdinalScales.effectivenessOrdinal("Miraculous"));
		assertEquals(OrdinalScales.DEFAULT_EFFECTIVENESS, OrdinalScales.effectivenessOrdinal(null));
		assertEquals(OrdinalScales.DEFAULT_SIDE_EFFECTS, OrdinalScales.sideEffectOrdinal(""));
		assertEquals(OrdinalScales.DEFAULT_SIDE_EFFECTS, OrdinalScales.sideEffectOrdinal("Weird"));
	}

	@Test
	void side_effect_labels_map_to_five_point_scale() {
		assertEquals(1, OrdinalScales.sideEffectOrdinal("No Side Effects"));
		assertEquals(4, OrdinalScales.sideEffectOrdinal("SEVERE SIDE EFFECTS"));
		assertEquals(5, OrdinalScales.sideEffectOrdinal("Extremely Severe Side Effects"));
	}

	@Test
	void averaged_effectiveness_bands() {
		assertEquals("Highly Effective", OrdinalScales.effectivenessLabel(4.5));
		assertEquals("Considerably Effective", OrdinalScales.effectivenessLabel(4.49));
		assertEquals("Considerably Effective", OrdinalScales.effectivenessLabel(3.5));
		assertEquals("Moderately Effective", OrdinalScales.effectivenessLabel(2.5));
		assertEquals("Marginally Effective", OrdinalScales.effectivenessLabel(1.0));
	}

	@Test
	void averaged_side_effect_bands() {
		assertEquals("Low Risk", OrdinalScales.sideEffectRiskLabel(1.5));
		assertEquals("Mild Risk", OrdinalScales.sideEffectRiskLabel(2.5));
		assertEquals("Moderate Risk", OrdinalScales.sideEffectRiskLabel(3.5));
		assertEquals("High Risk", OrdinalScales.sideEffectRiskLabel(3.51));
	}
}
