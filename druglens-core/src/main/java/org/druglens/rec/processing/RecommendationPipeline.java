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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.druglens.rec.dosage.DosageRuleEngine;
import org.druglens.rec.explain.AttributionEngine;
import org.druglens.rec.explain.ExplanationNormalizer;
import org.druglens.rec.index.OrdinalScales;
import org.druglens.rec.matching.ConditionMatcher;
import org.druglens.rec.om.ConditionDrugStats;
import org.druglens.rec.om.Direction;
import org.druglens.rec.om.DosageRecommendation;
import org.druglens.rec.om.DrugInteraction;
import org.druglens.rec.om.DrugRecommendation;
import org.druglens.rec.om.Explanation;
import org.druglens.rec.om.PatientProfile;
import org.druglens.rec.om.PredictionResult;
import org.druglens.rec.om.ScoredCandidate;
import org.druglens.rec.safety.SafetyScreener;
import org.druglens.rec.scoring.DrugScorer;
import org.druglens.rec.util.Logger;
import org.druglens.rec.util.Terms;

/**
 * Turns a patient profile into recommendations, explanations and interaction
 * warnings.
 *
 * Stages: match conditions → score and rank → per candidate (allergy filter,
 * dosage, explanations, screening) → supportive-care fallback when nothing
 * survived → normalize explanations.
 * <p>
 * Holds only read-only collaborators, so one instance serves concurrent
 * requests.
 */
public class RecommendationPipeline {

	public static final int MAX_RECOMMENDATIONS = 3;

	/** Upper bound on confidence. */
	public static final double MAX_CONFIDENCE = 0.95;

	/** Composite score that maps to confidence 1.0 before capping. */
	static final double CONFIDENCE_SCALE = 15.0;

	public static final String SUPPORTIVE_CARE = "General Supportive Care";
	static final double SUPPORTIVE_CARE_CONFIDENCE = 0.65;

	private final ConditionMatcher matcher;
	private final DrugScorer scorer;
	private final AttributionEngine attribution;
	private final SafetyScreener screener;
	private final DosageRuleEngine dosage;

	public RecommendationPipeline(RecommenderContext context) {
		this(new ConditionMatcher(), new DrugScorer(context.getIndex()), new AttributionEngine(context.getModel()),
				new SafetyScreener(), new DosageRuleEngine());
	}

	RecommendationPipeline(ConditionMatcher matcher, DrugScorer scorer, AttributionEngine attribution,
			SafetyScreener screener, DosageRuleEngine dosage) {
		this.matcher = matcher;
		this.scorer = scorer;
		this.attribution = attribution;
		this.screener = screener;
		this.dosage = dosage;
	}

	public boolean isModelBacked() {
		return attribution.isModelBacked();
	}

	public PredictionResult predict(PatientProfile patient) {
		Set<String> conditions = matcher.matchOrDefault(patient.getSymptoms(), patient.getMedicalHistory());
		Logger.debug("Matched conditions: {}", conditions);

		List<ScoredCandidate> ranked = scorer.rank(conditions);

		List<DrugRecommendation> recommendations = new ArrayList<>();
		List<Explanation> explanations = new ArrayList<>();
		List<DrugInteraction> interactions = new ArrayList<>();

		for (ScoredCandidate candidate : ranked.subList(0, Math.min(MAX_RECOMMENDATIONS, ranked.size()))) {
			if (SafetyScreener.isAllergic(candidate.getDrug(), patient.getAllergies())) {
				Logger.debug("Skipping {}: matches a patient allergy", candidate.getDrug());
				continue;
			}

			DosageRecommendation dose = dosage.recommend(patient.getAge(), patient.getHeartRate());
			recommendations.add(toRecommendation(candidate, dose));
			explanations.addAll(attribution.explain(candidate.getStats(), patient));
			interactions.addAll(
					screener.screen(candidate.getDrug(), patient.getCurrentMedications(), patient.getAllergies()));
		}

		if (recommendations.isEmpty()) {
			Logger.debug("No candidate survived filtering; recommending supportive care");
			recommendations.add(supportiveCare());
			explanations = supportiveCareExplanations();
		}

		return new PredictionResult(recommendations, ExplanationNormalizer.normalize(explanations), interactions);
	}

	static DrugRecommendation toRecommendation(ScoredCandidate candidate, DosageRecommendation dose) {
		ConditionDrugStats stats = candidate.getStats();
		return new DrugRecommendation(Terms.titleCase(candidate.getDrug()), confidence(candidate.getScore()),
				dose.getDosage(), dose.getDoseModifier(), dose.getFrequency(),
				OrdinalScales.effectivenessLabel(stats.getAvgEffectiveness()),
				OrdinalScales.sideEffectRiskLabel(stats.getAvgSideEffects()), candidate.getCondition());
	}

	/** score / 15 clamped into [0, 0.95], two decimals. */
	static double confidence(double score) {
		double c = Math.max(0.0, Math.min(MAX_CONFIDENCE, score / CONFIDENCE_SCALE));
		return Terms.round(c, 2);
	}

	static DrugRecommendation supportiveCare() {
		return new DrugRecommendation(SUPPORTIVE_CARE, SUPPORTIVE_CARE_CONFIDENCE, "As directed", 1.0,
				"Per physician instructions", "Varies", OrdinalScales.LOW_RISK, "general");
	}

	static List<Explanation> supportiveCareExplanations() {
		List<Explanation> out = new ArrayList<>(2);
		out.add(new Explanation("No specific drug indication from symptoms", 50.0, Direction.NEGATIVE));
		out.add(new Explanation("Physician consultation recommended", 50.0, Direction.POSITIVE));
		return out;
	}
}
