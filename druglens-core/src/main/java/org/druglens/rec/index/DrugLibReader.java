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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.druglens.rec.om.ReviewRecord;
import org.druglens.rec.util.Logger;

/**
 * Reads drugLib raw review files (tab-delimited, header row).
 *
 * Expected headers: (unnamed index), urlDrugName, rating, effectiveness,
 * sideEffects, condition, benefitsReview, sideEffectsReview, commentsReview.
 * Only urlDrugName, condition and effectiveness are required; a file lacking
 * any of them is rejected outright.
 */
public final class DrugLibReader {

	public static final String COL_DRUG = "urlDrugName";
	public static final String COL_RATING = "rating";
	public static final String COL_EFFECTIVENESS = "effectiveness";
	public static final String COL_SIDE_EFFECTS = "sideEffects";
	public static final String COL_CONDITION = "condition";
	public static final String COL_BENEFITS_REVIEW = "benefitsReview";
	public static final String COL_SIDE_EFFECTS_REVIEW = "sideEffectsReview";
	public static final String COL_COMMENTS_REVIEW = "commentsReview";

	private static final String[] REQUIRED = { COL_DRUG, COL_CONDITION, COL_EFFECTIVENESS };

	private DrugLibReader() {
	}

	/** Read and concatenate several files in the given order. */
	public static List<ReviewRecord> readAll(Collection<Path> files) throws IOException {
		List<ReviewRecord> all = new ArrayList<>();
		for (Path f : files) {
			all.addAll(read(f));
		}
		Logger.info("Loaded {} review rows from {} file(s)", all.size(), files.size());
		return all;
	}

	public static List<ReviewRecord> read(Path file) throws IOException {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(reader, file.toString());
		}
	}

	/**
	 * Parse review rows from an open reader.
	 *
	 * @param reader     tab-delimited content with a header row
	 * @param sourceName used in log messages only
	 * @throws IllegalArgumentException if a required column is missing
	 */
	public static List<ReviewRecord> read(Reader reader, String sourceName) throws IOException {
		CSVFormat tsv = CSVFormat.DEFAULT.withDelimiter('\t').withHeader().withIgnoreHeaderCase()
				.withAllowMissingColumnNames().withTrim();

		List<ReviewRecord> rows = new ArrayList<>();
		int lineNo = 0;
		int badRows = 0;

		try (CSVParser csv = new CSVParser(reader, tsv)) {
			requireColumns(csv.getHeaderNames(), sourceName);

			for (CSVRecord r : csv) {
				lineNo++;
				try {
					ReviewRecord rec = new ReviewRecord();
					rec.setDrugName(field(r, COL_DRUG));
					rec.setCondition(field(r, COL_CONDITION));
					rec.setRating(parseRating(field(r, COL_RATING)));
					rec.setEffectiveness(field(r, COL_EFFECTIVENESS));
					rec.setSideEffects(field(r, COL_SIDE_EFFECTS));
					rec.setBenefitsReview(field(r, COL_BENEFITS_REVIEW));
					rec.setSideEffectsReview(field(r, COL_SIDE_EFFECTS_REVIEW));
					rec.setCommentsReview(field(r, COL_COMMENTS_REVIEW));
					rows.add(rec);
				} catch (RuntimeException rowEx) {
					badRows++;
					Logger.warn("Parsing error in {} row {}: {}", sourceName, lineNo, rowEx.getMessage());
				}
			}
		} catch (UncheckedIOException e) {
			throw e.getCause();
		}

		Logger.debug("{}: rows={}, bad-rows={}", sourceName, rows.size(), badRows);
		return rows;
	}

	private static void requireColumns(List<String> headers, String sourceName) {
		for (String col : REQUIRED) {
			boolean present = headers.stream().anyMatch(h -> col.equalsIgnoreCase(h));
			if (!present) {
				throw new IllegalArgumentException("Missing required column '" + col + "' in " + sourceName);
			}
		}
	}

	private static String field(CSVRecord r, String name) {
		if (!r.isMapped(name) || !r.isSet(name)) {
			return null;
		}
		return StringUtils.trimToNull(r.get(name));
	}

	/** Ratings that are absent or not numeric are left null (indexed as the default). */
	static Double parseRating(String raw) {
		if (raw == null) {
			return null;
		}
		try {
			double v = Double.parseDouble(raw);
			return Double.isNaN(v) ? null : v;
		} catch (NumberFormatException nfe) {
			return null;
		}
	}
}
