package org.druglens.rec.om;

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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * Request-scoped patient description. Collections keep the caller's order and
 * are unmodifiable; nulls become empty collections or "".
 */
@Value
public class PatientProfile {

	int age;
	String gender;
	int heartRate;
	String bloodType;
	Set<String> allergies;
	Set<String> medicalHistory;
	Set<String> symptoms;

	/** Free text, e.g. "Lisinopril 10mg, warfarin". */
	String currentMedications;

	@Builder
	public PatientProfile(int age, String gender, int heartRate, String bloodType, Collection<String> allergies,
			Collection<String> medicalHistory, Collection<String> symptoms, String currentMedications) {
		this.age = age;
		this.gender = gender == null ? "" : gender;
		this.heartRate = heartRate;
		this.bloodType = bloodType == null ? "" : bloodType;
		this.allergies = copyOf(allergies);
		this.medicalHistory = copyOf(medicalHistory);
		this.symptoms = copyOf(symptoms);
		this.currentMedications = currentMedications == null ? "" : currentMedications;
	}

	private static Set<String> copyOf(Collection<String> values) {
		if (values == null || values.isEmpty()) {
			return Collections.emptySet();
		}
		Set<String> out = new LinkedHashSet<>();
		values.stream().filter(Objects::nonNull).forEach(out::add);
		return Collections.unmodifiableSet(out);
	}
}
