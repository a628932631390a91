package org.druglens.rec.explain;

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
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.druglens.rec.om.ConditionDrugStats;
import org.druglens.rec.om.Direction;
import org.druglens.rec.om.Explanation;
import org.druglens.rec.om.PatientProfile;
import org.druglens.rec.util.Terms;

/**
 * Produces the "why this drug" factors for one candidate.
 * <p>
 * With a trained {@link AttributionModel} the four features are explained by
 * the model's attributions, converted to percentages. Without one, a fixed
 * heuristic over the same statistics is used. Either way the four factors are
 * sorted by influence and followed by the patient factors (age, and heart
 * rate when in the normal range).
 */
public class AttributionEngine {

	/** Added to the attribution total so an all-zero vector does not divide by zero. */
	static final double ATTRIBUTION_EPSILON = 0.001;

	private final AttributionModel model;

	public AttributionEngine(Optional<AttributionModel> model) {
		this.model = model.orElse(null);
	}

	public boolean isModelBacked() {
		return model != null;
	}

	/** Feature factors followed by patient factors. */
	public List<Explanation> explain(ConditionDrugStats stats, PatientProfile patient) {
		List<Explanation> out = model != null ? modelExplanations(stats) : fallbackExplanations(stats);
		out.addAll(patientFactors(patient));
		return out;
	}

	/** Influence_i = |a_i| / (sum |a| + 0.001) * 100, one decimal. */
	public List<Explanation> modelExplanations(ConditionDrugStats stats) {
		double[] attributions = model.explain(FeatureVector.of(stats));

		double total = 0.0;
		for (double a : attributions) {
			total += Math.abs(a);
		}

		List<Explanation> out = new ArrayList<>(FeatureVector.SIZE);
		for (int i = 0; i < FeatureVector.SIZE; i++) {
			double influence = Math.abs(attributions[i]) / (total + ATTRIBUTION_EPSILON) * 100.0;
			out.add(new Explanation(FeatureVector.NAMES.get(i), Terms.round(influence, 1),
					Direction.of(attributions[i])));
		}
		out.sort(byInfluenceDescending());
		return out;
	}

	public List<Explanation> fallbackExplanations(ConditionDrugStats stats) {
		double rating = stats.getAvgRating();
		double effectiveness = stats.getAvgEffectiveness();
		double sideEffects = stats.getAvgSideEffects();
		int reviews = stats.getReviewCount();

		List<Explanation> out = new ArrayList<>(FeatureVector.SIZE);
		out.add(new Explanation(String.format(Locale.ROOT, "Average patient rating (%.1f/10)", rating),
				Terms.round(Math.min(rating * 5, 40), 1), Direction.of(rating >= 7)));
		out.add(new Explanation("Drug effectiveness score", Terms.round(effectiveness * 8, 1), Direction.POSITIVE));
		out.add(new Explanation("Low side effect profile", Terms.round(Math.max((5 - sideEffects) * 6, 5), 1),
				Direction.of(sideEffects <= 2)));
		out.add(new Explanation("Clinical evidence (" + reviews + " reviews)",
				Terms.round(Math.min(reviews * 0.5, 15), 1), Direction.POSITIVE));
		out.sort(byInfluenceDescending());
		return out;
	}

	/** Age factor always; heart-rate factor only for 60 < hr < 100. */
	public List<Explanation> patientFactors(PatientProfile patient) {
		List<Explanation> out = new ArrayList<>(2);
		int age = patient.getAge();
		boolean adult = age >= 18 && age <= 65;
		out.add(new Explanation("Age factor (" + age + " years)", adult ? 10.0 : 5.0, Direction.of(adult)));

		int hr = patient.getHeartRate();
		if (hr > 60 && hr < 100) {
			out.add(new Explanation("Normal heart rate (" + hr + " bpm)", 8.0, Direction.POSITIVE));
		}
		return out;
	}

	static Comparator<Explanation> byInfluenceDescending() {
		return Comparator.comparingDouble(Explanation::getInfluence).reversed();
	}
}
