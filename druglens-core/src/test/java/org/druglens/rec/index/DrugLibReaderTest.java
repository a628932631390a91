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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.druglens.rec.om.ReviewRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DrugLibReaderTest {

	private static final String FIXTURE = "druglib/sample_reviews.tsv";

	@TempDir
	Path tmp;

	private static Path fixturePath() throws URISyntaxException {
		return Path.of(DrugLibReaderTest.class.getClassLoader().getResource(FIXTURE).toURI());
	}

	@Test
	void reads_fixture_rows_with_all_columns() throws IOException {
		List<ReviewRecord> rows;
		try (Reader in = new InputStreamReader(getClass().getClassLoader().getResourceAsStream(FIXTURE),
				StandardCharsets.UTF_8)) {
			rows = DrugLibReader.read(in, FIXTURE);
		}

		assertEquals(5, rows.size());
		ReviewRecord first = rows.get(0);
		assertEquals("enalapril", first.getDrugName());
		assertEquals("management of congestive heart failure", first.getCondition());
		assertEquals(4.0, first.getRating());
		assertEquals("Highly Effective", first.getEffectiveness());
		assertEquals("Mild Side Effects", first.getSideEffects());
		assertEquals("a hacking cough", first.getSideEffectsReview());
		assertEquals("monitor blood pressure weekly", first.getCommentsReview());
	}

	@Test
	void blank_cells_become_null() throws IOException {
		List<ReviewRecord> rows = DrugLibReader.read(new InputStreamReader(
				getClass().getClassLoader().getResourceAsStream(FIXTURE), StandardCharsets.UTF_8), FIXTURE);

		ReviewRecord prilosec = rows.get(3);
		assertEquals("prilosec", prilosec.getDrugName());
		assertNull(prilosec.getRating());

		ReviewRecord lyrica = rows.get(4);
		assertNull(lyrica.getCondition());
	}

	@Test
	void fixture_feeds_the_index_builder() throws Exception {
		ConditionIndexBuilder b = new ConditionIndexBuilder();
		DrugLibReader.read(fixturePath()).forEach(b::add);

		assertEquals(4, b.getAccepted());
		assertEquals(1, b.getDiscarded());
		ConditionIndex index = b.build();
		assertNotNull(index.getStats("acid reflux", "prilosec").orElse(null));
		assertEquals(ConditionIndexBuilder.DEFAULT_RATING,
				index.getStats("acid reflux", "prilosec").orElseThrow().getAvgRating(), 1e-9);
	}

	@Test
	void readAll_concatenates_files_in_order() throws Exception {
		Path extra = tmp.resolve("extra.tsv");
		Files.writeString(extra, "\turlDrugName\trating\teffectiveness\tsideEffects\tcondition\n"
				+ "1\taspirin\t7\tModerately Effective\tMild Side Effects\theadache\n", StandardCharsets.UTF_8);

		List<ReviewRecord> rows = DrugLibReader.readAll(List.of(fixturePath(), extra));

		assertEquals(6, rows.size());
		assertEquals("aspirin", rows.get(5).getDrugName());
		assertNull(rows.get(5).getBenefitsReview(), "absent optional column reads as null");
	}

	@Test
	void missing_required_column_is_rejected() {
		String noEffectiveness = "urlDrugName\trating\tcondition\naspirin\t7\theadache\n";
		IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
				() -> DrugLibReader.read(new StringReader(noEffectiveness), "broken.tsv"));
		assertTrue(ex.getMessage().contains("effectiveness"));
		assertTrue(ex.getMessage().contains("broken.tsv"));
	}

	@Test
	void parseRating_tolerates_garbage() {
		assertEquals(7.5, DrugLibReader.parseRating("7.5"));
		assertNull(DrugLibReader.parseRating("n/a"));
		assertNull(DrugLibReader.parseRating("NaN"));
		assertNull(DrugLibReader.parseRating(null));
	}
}
