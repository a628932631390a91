package org.druglens.rec.conf;

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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.druglens.rec.om.PatientProfile;

/**
 * Reads a {@link PatientProfile} from a {@code .properties} file.
 *
 * <pre>
 * age=45
 * gender=male
 * heart_rate=75
 * blood_type=A+
 * allergies=Penicillin
 * medical_history=Hypertension
 * symptoms=Headache, Fever
 * current_medications=Lisinopril 10mg
 * </pre>
 *
 * List values are comma separated. {@code age} and {@code heart_rate} are
 * required integers; other keys default to empty.
 */
public final class PatientProfileReader {

	public static final String K_AGE = "age";
	public static final String K_GENDER = "gender";
	public static final String K_HEART_RATE = "heart_rate";
	public static final String K_BLOOD_TYPE = "blood_type";
	public static final String K_ALLERGIES = "allergies";
	public static final String K_MEDICAL_HISTORY = "medical_history";
	public static final String K_SYMPTOMS = "symptoms";
	public static final String K_CURRENT_MEDICATIONS = "current_medications";

	private PatientProfileReader() {
	}

	public static PatientProfile read(Path file) throws IOException {
		Properties p = new Properties();
		try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			p.load(in);
		}
		return fromProperties(p);
	}

	/**
	 * @throws IllegalArgumentException if age or heart rate is missing or not an
	 *                                  integer
	 */
	public static PatientProfile fromProperties(Properties p) {
		return PatientProfile.builder()
				.age(requireInt(p, K_AGE))
				.gender(StringUtils.trimToEmpty(p.getProperty(K_GENDER)))
				.heartRate(requireInt(p, K_HEART_RATE))
				.bloodType(StringUtils.trimToEmpty(p.getProperty(K_BLOOD_TYPE)))
				.allergies(list(p, K_ALLERGIES))
				.medicalHistory(list(p, K_MEDICAL_HISTORY))
				.symptoms(list(p, K_SYMPTOMS))
				.currentMedications(StringUtils.trimToEmpty(p.getProperty(K_CURRENT_MEDICATIONS)))
				.build();
	}

	private static int requireInt(Properties p, String key) {
		String raw = StringUtils.trimToNull(p.getProperty(key));
		if (raw == null) {
			throw new IllegalArgumentException("Missing required patient field: " + key);
		}
		try {
			return Integer.parseInt(raw);
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("Patient field " + key + " is not an integer: '" + raw + "'", nfe);
		}
	}

	private static List<String> list(Properties p, String key) {
		String raw = p.getProperty(key);
		if (StringUtils.isBlank(raw)) {
			return List.of();
		}
		return Arrays.stream(raw.split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.collect(Collectors.toList());
	}
}
