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

import java.util.List;
import java.util.Optional;

/**
 * Trainable classifier capability behind the attribution engine.
 */
public interface AttributionClassifier {

	/**
	 * Train over aligned feature vectors and 0/1 labels.
	 *
	 * @return the trained model, or empty when a model cannot be produced from
	 *         this data
	 */
	Optional<AttributionModel> train(List<double[]> features, List<Integer> labels);

	/** Short name used in health output and logs. */
	String name();
}
