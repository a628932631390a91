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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import org.druglens.rec.explain.AttributionClassifier;
import org.druglens.rec.om.PatientProfile;
import org.druglens.rec.om.PredictionResult;
import org.druglens.rec.om.ReviewRecord;
import org.druglens.rec.util.Logger;

/**
 * Readiness-gated entry point. The pipeline is published once the load phase
 * finishes; until then {@link #predict} fails fast with
 * {@link ServiceNotReadyException} instead of waiting.
 */
public class DrugRecommenderService {

	private final AttributionClassifier classifier;
	private final AtomicReference<RecommendationPipeline> pipeline = new AtomicReference<>();

	/**
	 * @param classifier trainer for the attribution model, or null for heuristic
	 *                   explanations only
	 */
	public DrugRecommenderService(AttributionClassifier classifier) {
		this.classifier = classifier;
	}

	/** Blocking load: index the records, train, then become ready. */
	public void load(Collection<ReviewRecord> records) {
		Logger.info("Loading drug recommendation model from {} record(s)...", records.size());
		RecommenderContext context = RecommenderContext.build(records, classifier);
		start(context);
	}

	/**
	 * Run {@code source} and the load phase on {@code executor}. The returned
	 * future completes exceptionally if reading or indexing fails, in which case
	 * the service stays not ready.
	 */
	public CompletableFuture<Void> loadAsync(Callable<? extends Collection<ReviewRecord>> source, Executor executor) {
		return CompletableFuture.runAsync(() -> {
			try {
				load(source.call());
			} catch (RuntimeException e) {
				Logger.error("Model load failed", e);
				throw e;
			} catch (Exception e) {
				Logger.error("Model load failed", e);
				throw new CompletionException(e);
			}
		}, executor);
	}

	/** Publish an already built context. */
	public void start(RecommenderContext context) {
		RecommendationPipeline p = new RecommendationPipeline(context);
		pipeline.set(p);
		Logger.info("Model loaded: aggregates={}, explanations={}", context.getIndex().size(),
				p.isModelBacked() ? "model" : "heuristic");
	}

	public boolean isReady() {
		return pipeline.get() != null;
	}

	/**
	 * @throws ServiceNotReadyException if loading has not completed
	 */
	public PredictionResult predict(PatientProfile patient) throws ServiceNotReadyException {
		RecommendationPipeline p = pipeline.get();
		if (p == null) {
			throw new ServiceNotReadyException("Model not loaded");
		}
		return p.predict(patient);
	}

	/** status, model_loaded, and (once loaded) which explanation path is active. */
	public Map<String, Object> health() {
		RecommendationPipeline p = pipeline.get();
		Map<String, Object> out = new LinkedHashMap<>();
		out.put("status", "healthy");
		out.put("model_loaded", p != null);
		if (p != null) {
			out.put("classifier", p.isModelBacked() ? modelName() : "fallback");
		}
		return out;
	}

	/** A context started directly may carry a model this service did not train. */
	private String modelName() {
		return classifier != null ? classifier.name() : "model";
	}
}
