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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import org.druglens.rec.util.Logger;

import opennlp.tools.ml.AbstractEventTrainer;
import opennlp.tools.ml.EventTrainer;
import opennlp.tools.ml.TrainerFactory;
import opennlp.tools.ml.maxent.GISTrainer;
import opennlp.tools.ml.model.Event;
import opennlp.tools.ml.model.MaxentModel;
import opennlp.tools.util.ObjectStreamUtils;
import opennlp.tools.util.TrainingParameters;
import opennlp.tools.util.model.ModelUtil;

/**
 * OpenNLP maxent (GIS) classifier over real-valued features.
 * <p>
 * Each feature is one context predicate whose value is the feature scaled
 * into [0, 1]. Attributions are computed by occlusion: feature i contributes
 * the drop in log-odds of the "good" outcome when it is replaced by its
 * training mean. The model is log-linear, so these contributions add up to
 * the log-odds difference from the all-means baseline.
 */
public class MaxentAttributionClassifier implements AttributionClassifier {

	static final String GOOD = "good";
	static final String POOR = "poor";

	/** Context predicates, index-aligned with {@link FeatureVector}. */
	private static final String[] CONTEXT = { "rating", "effectiveness", "side_effects", "evidence" };

	/** Divisors mapping each raw feature into [0, 1]. */
	private static final double[] SCALE = { 10.0, 5.0, 5.0, FeatureVector.REVIEW_COUNT_CAP };

	private static final double EPS = 1e-9;

	private final int iterations;

	public MaxentAttributionClassifier(int iterations) {
		if (iterations <= 0) {
			throw new IllegalArgumentException("iterations must be positive: " + iterations);
		}
		this.iterations = iterations;
	}

	@Override
	public String name() {
		return "maxent";
	}

	@Override
	public Optional<AttributionModel> train(List<double[]> features, List<Integer> labels) {
		if (features.size() != labels.size()) {
			throw new IllegalArgumentException(
					"features/labels size mismatch: " + features.size() + " vs " + labels.size());
		}
		long positives = labels.stream().filter(l -> l == 1).count();
		if (positives == 0 || positives == labels.size()) {
			Logger.warn("Attribution model not trained: all {} examples share one label", labels.size());
			return Optional.empty();
		}

		List<Event> events = new ArrayList<>(features.size());
		double[] mean = new double[FeatureVector.SIZE];
		for (int i = 0; i < features.size(); i++) {
			double[] x = features.get(i);
			events.add(new Event(labels.get(i) == 1 ? GOOD : POOR, CONTEXT, scale(x)));
			for (int f = 0; f < FeatureVector.SIZE; f++) {
				mean[f] += x[f] / features.size();
			}
		}

		TrainingParameters params = ModelUtil.createDefaultTrainingParameters();
		params.put(TrainingParameters.ALGORITHM_PARAM, GISTrainer.MAXENT_VALUE);
		params.put(TrainingParameters.ITERATIONS_PARAM, iterations);
		params.put(TrainingParameters.CUTOFF_PARAM, 0);
		params.put(AbstractEventTrainer.DATA_INDEXER_PARAM, AbstractEventTrainer.DATA_INDEXER_ONE_PASS_REAL_VALUE);

		try {
			EventTrainer trainer = TrainerFactory.getEventTrainer(params, new HashMap<>());
			MaxentModel model = trainer.train(ObjectStreamUtils.createObjectStream(events));
			Logger.info("Attribution model trained: examples={}, positives={}, iterations={}", events.size(),
					positives, iterations);
			return Optional.of(new MaxentAttributionModel(model, mean));
		} catch (IOException | RuntimeException e) {
			Logger.warn("Attribution model training failed; falling back to heuristic explanations", e);
			return Optional.empty();
		}
	}

	static float[] scale(double[] x) {
		if (x.length != FeatureVector.SIZE) {
			throw new IllegalArgumentException("Expected " + FeatureVector.SIZE + " features, got " + x.length);
		}
		float[] values = new float[x.length];
		for (int i = 0; i < x.length; i++) {
			values[i] = (float) Math.max(0.0, x[i] / SCALE[i]);
		}
		return values;
	}

	/** Trained model plus the training means used as the occlusion baseline. */
	static final class MaxentAttributionModel implements AttributionModel {

		private final MaxentModel model;
		private final double[] baseline;
		private final int goodIndex;

		MaxentAttributionModel(MaxentModel model, double[] baseline) {
			this.model = model;
			this.baseline = baseline.clone();
			this.goodIndex = model.getIndex(GOOD);
		}

		@Override
		public double probability(double[] features) {
			return model.eval(CONTEXT, scale(features))[goodIndex];
		}

		@Override
		public double[] explain(double[] features) {
			double full = logOdds(features);
			double[] out = new double[FeatureVector.SIZE];
			for (int i = 0; i < FeatureVector.SIZE; i++) {
				double[] occluded = features.clone();
				occluded[i] = baseline[i];
				out[i] = full - logOdds(occluded);
			}
			return out;
		}

		double[] getBaseline() {
			return baseline.clone();
		}

		private double logOdds(double[] features) {
			double p = Math.min(1.0 - EPS, Math.max(EPS, probability(features)));
			return Math.log(p / (1.0 - p));
		}
	}
}
