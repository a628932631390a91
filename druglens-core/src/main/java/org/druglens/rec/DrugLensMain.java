package org.druglens.rec;

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

import java.nio.file.Path;
import java.util.List;

import org.druglens.rec.conf.ConfigLoader;
import org.druglens.rec.conf.PatientProfileReader;
import org.druglens.rec.explain.AttributionClassifier;
import org.druglens.rec.explain.MaxentAttributionClassifier;
import org.druglens.rec.index.DrugLibReader;
import org.druglens.rec.om.DrugInteraction;
import org.druglens.rec.om.DrugRecommendation;
import org.druglens.rec.om.Explanation;
import org.druglens.rec.om.PatientProfile;
import org.druglens.rec.om.PredictionResult;
import org.druglens.rec.processing.DrugRecommenderService;
import org.druglens.rec.util.Logger;

/**
 * Command line entry point.
 *
 * Loads the drugLib review files named in the configuration, builds the
 * condition index and attribution model, and, when given a patient profile
 * file, prints one prediction.
 *
 * Usage: {@code DrugLensMain [patient.properties]}
 */
public class DrugLensMain {

	private final ConfigLoader cfg;

	public DrugLensMain(ConfigLoader cfg) {
		this.cfg = cfg;
	}

	public static void main(String[] args) throws Exception {
		DrugLensMain app = new DrugLensMain(new ConfigLoader());
		int rc = app.run(args.length > 0 ? Path.of(args[0]) : null);
		if (rc != 0) {
			System.exit(rc);
		}
	}

	/**
	 * @param patientFile profile to predict for, or null to only load
	 * @return process exit code
	 */
	int run(Path patientFile) throws Exception {
		List<String> issues = cfg.validate();
		if (!issues.isEmpty()) {
			issues.forEach(i -> Logger.error("Configuration: {}", i));
			return 2;
		}

		AttributionClassifier classifier = cfg.isClassifierEnabled()
				? new MaxentAttributionClassifier(cfg.getClassifierIterations())
				: null;

		DrugRecommenderService service = new DrugRecommenderService(classifier);
		service.load(DrugLibReader.readAll(cfg.getDrugLibFiles()));
		Logger.info("Health: {}", service.health());

		if (patientFile == null) {
			return 0;
		}

		PatientProfile patient = PatientProfileReader.read(patientFile);
		report(service.predict(patient));
		return 0;
	}

	private static void report(PredictionResult result) {
		Logger.info("Recommendations:");
		for (DrugRecommendation r : result.getRecommendations()) {
			Logger.info("  {} (confidence {}) {} x{} {} | {} | {} | condition: {}", r.getName(),
					r.getConfidence(), r.getDosage(), r.getDoseModifier(), r.getFrequency(), r.getEffectiveness(),
					r.getSideEffectsRisk(), r.getConditionMatch());
		}
		Logger.info("Explanations:");
		for (Explanation e : result.getExplanations()) {
			Logger.info("  {}% {} [{}]", e.getInfluence(), e.getFeature(), e.getDirection());
		}
		if (result.getInteractions().isEmpty()) {
			Logger.info("No interactions found.");
		} else {
			Logger.info("Interactions:");
			for (DrugInteraction i : result.getInteractions()) {
				Logger.warn("  [{}] {} / {}: {}", i.getSeverity(), i.getDrug1(), i.getDrug2(), i.getDescription());
			}
		}
	}
}
