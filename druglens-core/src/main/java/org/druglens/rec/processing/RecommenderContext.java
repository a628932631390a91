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
import java.util.Optional;

import org.druglens.rec.explain.AttributionClassifier;
import org.druglens.rec.explain.AttributionModel;
import org.druglens.rec.explain.FeatureVector;
import org.druglens.rec.index.ConditionIndex;
import org.druglens.rec.index.ConditionIndexBuilder;
import org.druglens.rec.om.ConditionDrugStats;
import org.druglens.rec.om.ReviewRecord;
import org.druglens.rec.util.Logger;

/**
 * Everything built at load time and shared read-only by every request: the
 * condition index and, when one could be trained, the attribution model.
 */
public final class RecommenderContext {

	/** Training needs strictly more aggregates than this. */
	public static final int MIN_TRAINING_EXAMPLES = 10;

	private final ConditionIndex index;
	private final AttributionModel model;

	public RecommenderContext(ConditionIndex index, Optional<AttributionModel> model) {
		this.index = index;
		this.model = model.orElse(null);
	}

	/** Index the records, then train the attribution model if possible. */
	public static RecommenderContext build(Iterable<ReviewRecord> records, AttributionClassifier classifier) {
		return build(ConditionIndexBuilder.fromRecords(records), classifier);
	}

	/**
	 * @param classifier null to skip training and always use the heuristic
	 *                   explanations
	 */
	public static RecommenderContext build(ConditionIndex index, AttributionClassifier classifier) {
		if (classifier == null) {
			Logger.info("Attribution classifier disabled; heuristic explanations will be used");
			return new RecommenderContext(index, Optional.empty());
		}

		List<double[]> features = new ArrayList<>(index.size());
		List<Integer> labels = new ArrayList<>(index.size());
		for (ConditionDrugStats stats : index.allStats()) {
			features.add(FeatureVector.of(stats));
			labels.add(FeatureVector.label(stats));
		}

		if (features.size() <= MIN_TRAINING_EXAMPLES) {
			Logger.warn("Only {} aggregate(s) available; attribution model not trained", features.size());
			return new RecommenderContext(index, Optional.empty());
		}
		return new RecommenderContext(index, classifier.train(features, labels));
	}

	public ConditionIndex getIndex() {
		return index;
	}

	public Optional<AttributionModel> getModel() {
		return Optional.ofNullable(model);
	}
}
