package org.druglens.rec.processing;

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
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.druglens.rec.explain.AttributionModel;
import org.druglens.rec.index.ConditionIndex;
import org.druglens.rec.index.ConditionIndexBuilder;
import org.druglens.rec.om.Direction;
import org.druglens.rec.om.DrugInteraction;
import org.druglens.rec.om.DrugRecommendation;
import org.druglens.rec.om.Explanation;
import org.druglens.rec.om.PatientProfile;
import org.druglens.rec.om.PredictionResult;
import org.druglens.rec.om.ReviewRecord;
import org.druglens.rec.om.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RecommendationPipelineTest {

	private RecommendationPipeline pipeline;

	private static ReviewRecord review(String drug, String condition, double rating, String eff, String se) {
		return new ReviewRecord(drug, condition, rating, eff, se);
	}

	private static ConditionIndex sampleIndex() {
		return ConditionIndexBuilder.fromRecords(List.of(
				review("tamiflu", "flu", 8, "Highly Effective", "Mild Side Effects"),
				review("tamiflu", "flu", 10, "Considerably Effective", "No Side Effects"),
				review("amoxicillin", "sinus infection", 7, "Considerably Effective", "Mild Side Effects"),
				review("ibuprofen", "back pain", 6, "Moderately Effective", "Moderate Side Effects"),
				review("aspirin", "headache", 7, "Considerably Effective", "Mild Side Effects"),
				review("placebo", "common cold", 1, "Ineffective", "Extremely Severe Side Effects")));
	}

	private static PatientProfile.PatientProfileBuilder patient() {
		return PatientProfile.builder().age(45).gender("female").heartRate(75).bloodType("A+");
	}

	private static List<String> names(PredictionResult r) {
		return r.getRecommendations().stream().map(DrugRecommendation::getName).collect(Collectors.toList());
	}

	private static double influenceSum(PredictionResult r) {
		return r.getExplanations().stream().mapToDouble(Explanation::getInfluence).sum();
	}

	@BeforeEach
	void setUp() {
		pipeline = new RecommendationPipeline(new RecommenderContext(sampleIndex(), Optional.empty()));
	}

	@Test
	@DisplayName("Fever patient gets ranked flu and infection drugs with dosing and labels")
	void fever_patient_recommendations() {
		PredictionResult r = pipeline.predict(patient().symptoms(List.of("fever")).build());

		assertEquals(List.of("Tamiflu", "Amoxicillin", "Placebo"), names(r));

		DrugRecommendation top = r.getRecommendations().get(0);
		assertEquals(0.74, top.getConfidence(), 1e-9);
		assertEquals("500mg", top.getDosage());
		assertEquals(1.0, top.getDoseModifier(), 1e-9);
		assertEquals("Every 6 hours as needed", top.getFrequency());
		assertEquals("Highly Effective", top.getEffectiveness());
		assertEquals("Low Risk", top.getSideEffectsRisk());
		assertEquals("flu", top.getConditionMatch());

		DrugRecommendation second = r.getRecommendations().get(1);
		assertEquals(0.61, second.getConfidence(), 1e-9);
		assertEquals("Considerably Effective", second.getEffectiveness());
		assertEquals("Mild Risk", second.getSideEffectsRisk());
		assertEquals("sinus infection", second.getConditionMatch());

		assertTrue(r.getInteractions().isEmpty());
	}

	@Test
	void negative_scores_clamp_confidence_at_zero() {
		PredictionResult r = pipeline.predict(patient().symptoms(List.of("fever")).build());

		DrugRecommendation placebo = r.getRecommendations().get(2);
		// 0.3 + 2 - 2.5 + 0.1
		assertEquals(0.0, placebo.getConfidence(), 1e-9);
		assertEquals("Marginally Effective", placebo.getEffectiveness());
		assertEquals("High Risk", placebo.getSideEffectsRisk());
	}

	@Test
	void explanations_are_top_six_normalized_to_one_hundred() {
		PredictionResult r = pipeline.predict(patient().symptoms(List.of("fever")).build());

		assertEquals(6, r.getExplanations().size());
		assertEquals(100.0, influenceSum(r), 0.1);
		Explanation first = r.getExplanations().get(0);
		assertEquals("Average patient rating (9.0/10)", first.getFeature());
		assertEquals(Direction.POSITIVE, first.getDirection());
		for (int i = 1; i < r.getExplanations().size(); i++) {
			assertTrue(r.getExplanations().get(i - 1).getInfluence() >= r.getExplanations().get(i).getInfluence());
		}
	}

	@Test
	void allergic_candidates_are_skipped_without_backfill() {
		PredictionResult r = pipeline.predict(patient().symptoms(List.of("fever")).allergies(List.of("tamiflu"))
				.build());

		assertEquals(List.of("Amoxicillin", "Placebo"), names(r));
	}

	@Test
	@DisplayName("Every candidate excluded by allergy falls back to supportive care")
	void all_candidates_allergic_gives_supportive_care() {
		PredictionResult r = pipeline.predict(patient().symptoms(List.of("fever"))
				.allergies(List.of("tamiflu", "amoxicillin", "placebo")).build());

		assertEquals(1, r.getRecommendations().size());
		DrugRecommendation rec = r.getRecommendations().get(0);
		assertEquals(RecommendationPipeline.SUPPORTIVE_CARE, rec.getName());
		assertEquals(0.65, rec.getConfidence(), 1e-9);
		assertEquals("As directed", rec.getDosage());
		assertEquals(1.0, rec.getDoseModifier(), 1e-9);
		assertEquals("Low Risk", rec.getSideEffectsRisk());
		assertEquals(2, r.getExplanations().size());
		r.getExplanations().forEach(e -> assertEquals(50.0, e.getInfluence(), 1e-9));
		assertTrue(r.getInteractions().isEmpty());
	}

	@Test
	void no_symptoms_use_default_conditions() {
		PredictionResult r = pipeline.predict(patient().build());

		assertEquals(List.of("Amoxicillin", "Ibuprofen"), names(r));
		assertEquals("back pain", r.getRecommendations().get(1).getConditionMatch());
	}

	@Test
	void empty_index_gives_supportive_care() {
		RecommendationPipeline empty = new RecommendationPipeline(
				new RecommenderContext(ConditionIndex.empty(), Optional.empty()));

		PredictionResult r = empty.predict(patient().symptoms(List.of("fever")).build());

		assertEquals(List.of(RecommendationPipeline.SUPPORTIVE_CARE), names(r));
	}

	@Test
	void interactions_with_current_medications_are_reported() {
		PredictionResult r = pipeline.predict(patient().symptoms(List.of("headache"))
				.currentMedications("Warfarin 5mg").build());

		assertEquals("Aspirin", r.getRecommendations().get(0).getName());
		assertTrue(r.getInteractions().contains(new DrugInteraction("warfarin", "aspirin", Severity.MODERATE,
				"Aspirin may interact with warfarin. Consult physician.")), r.getInteractions().toString());
	}

	@Test
	void elderly_patient_dosing_is_adjusted() {
		PredictionResult r = pipeline.predict(PatientProfile.builder().age(70).heartRate(110)
				.symptoms(List.of("fever")).build());

		r.getRecommendations().forEach(rec -> {
			assertEquals("Every 8-12 hours (monitor heart rate)", rec.getFrequency());
			assertEquals(0.75, rec.getDoseModifier(), 1e-9);
		});
		assertFalse(r.getExplanations().stream().anyMatch(e -> e.getFeature().startsWith("Normal heart rate")));
	}

	@Test
	void model_backed_explanations_use_feature_names() {
		AttributionModel model = mock(AttributionModel.class);
		when(model.explain(any(double[].class))).thenReturn(new double[] { 3.0, 2.0, -1.0, 0.5 });
		RecommendationPipeline withModel = new RecommendationPipeline(
				new RecommenderContext(sampleIndex(), Optional.of(model)));
		assertTrue(withModel.isModelBacked());

		PredictionResult r = withModel.predict(patient().symptoms(List.of("fever")).build());

		assertEquals(6, r.getExplanations().size());
		assertEquals(100.0, influenceSum(r), 0.1);
		assertTrue(r.getExplanations().stream().anyMatch(e -> e.getFeature().equals("Patient Rating")));
	}

	@Test
	void child_dosing_carries_half_dose_modifier() {
		PredictionResult r = pipeline.predict(PatientProfile.builder().age(10).heartRate(50)
				.symptoms(List.of("fever")).build());

		DrugRecommendation top = r.getRecommendations().get(0);
		assertEquals("500mg", top.getDosage());
		assertEquals(0.5, top.getDoseModifier(), 1e-9);
		assertEquals("Every 6-8 hours (bradycardia noted)", top.getFrequency());
	}

	@Test
	void predictions_are_deterministic() {
		PatientProfile p = patient().symptoms(List.of("fever", "headache")).medicalHistory(List.of("asthma"))
				.currentMedications("lisinopril").build();

		assertEquals(pipeline.predict(p), pipeline.predict(p));
	}

	@Test
	void confidence_is_clamped_and_rounded() {
		assertEquals(0.95, RecommendationPipeline.confidence(30.0), 1e-9);
		assertEquals(0.0, RecommendationPipeline.confidence(-4.0), 1e-9);
		assertEquals(0.74, RecommendationPipeline.confidence(11.15), 1e-9);
	}
}
