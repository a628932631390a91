package org.druglens.rec.safety;

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
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.druglens.rec.om.DrugInteraction;
import org.druglens.rec.om.Severity;
import org.druglens.rec.util.Terms;

/**
 * Screens a candidate drug against the patient's current medications and
 * allergies.
 * <ul>
 * <li>A known medication mentioned in the current-medications text whose
 * conflict set contains the candidate: {@link Severity#MODERATE}.</li>
 * <li>The candidate is itself a known medication and one of its conflicts is
 * mentioned in the text: {@link Severity#HIGH}.</li>
 * <li>An allergy term contained in the drug name, or the other way round:
 * {@link Severity#HIGH}.</li>
 * </ul>
 * Every match is reported; nothing is deduplicated.
 */
public class SafetyScreener {

	public List<DrugInteraction> screen(String drug, String currentMedications, Collection<String> allergies) {
		String candidate = Terms.normalize(drug);
		String meds = StringUtils.defaultString(currentMedications).toLowerCase(Locale.ROOT);
		String display = Terms.titleCase(candidate);

		List<DrugInteraction> found = new ArrayList<>();

		for (Map.Entry<String, List<String>> e : InteractionTable.entries().entrySet()) {
			String med = e.getKey();
			List<String> conflicts = e.getValue();

			if (meds.contains(med) && conflicts.contains(candidate)) {
				found.add(new DrugInteraction(med, candidate, Severity.MODERATE,
						display + " may interact with " + med + ". Consult physician."));
			}
			if (candidate.equals(med)) {
				for (String conflict : conflicts) {
					if (meds.contains(conflict)) {
						found.add(new DrugInteraction(candidate, conflict, Severity.HIGH,
								display + " has known interaction with " + conflict + ". Use caution."));
					}
				}
			}
		}

		if (allergies != null) {
			for (String allergy : allergies) {
				if (isAllergyMatch(candidate, allergy)) {
					found.add(new DrugInteraction(candidate, allergy, Severity.HIGH,
							"Patient has documented allergy to " + allergy + ". AVOID " + display + "."));
				}
			}
		}
		return found;
	}

	/** True when any non-blank allergy overlaps the drug name. */
	public static boolean isAllergic(String drug, Collection<String> allergies) {
		if (allergies == null) {
			return false;
		}
		for (String allergy : allergies) {
			if (isAllergyMatch(drug, allergy)) {
				return true;
			}
		}
		return false;
	}

	private static boolean isAllergyMatch(String drug, String allergy) {
		return Terms.overlaps(drug, allergy);
	}
}
