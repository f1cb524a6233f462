package org.clinlens.ner.eval;

/*
 * This file is part of ClinLens.
 *
 * Copyright (C) 2025 The ClinLens Authors
 *
 * ClinLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ClinLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ClinLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.util.Locale;
import java.util.Map;

/**
 * Maps annotation label synonyms onto the pipeline's entity type names.
 * Labels outside the map are upper-cased and kept as they are.
 */
public final class LabelNormalizer {

	private static final Map<String, String> LABEL_MAP = Map.ofEntries(
			Map.entry("DIAGNOSIS", "PROBLEM"),
			Map.entry("DISEASE", "PROBLEM"),
			Map.entry("CONDITION", "PROBLEM"),
			Map.entry("SIGN", "SYMPTOM"),
			Map.entry("SYMPTOM", "SYMPTOM"),
			Map.entry("TEST", "TEST"),
			Map.entry("EXAM", "TEST"),
			Map.entry("EXAMINATION", "TEST"),
			Map.entry("DRUG", "DRUG"),
			Map.entry("MEDICATION", "DRUG"),
			Map.entry("MEDICINE", "DRUG"),
			Map.entry("PROCEDURE", "PROCEDURE"),
			Map.entry("ANATOMY", "ANATOMY"),
			Map.entry("BODY_PART", "ANATOMY"));

	private LabelNormalizer() {
	}

	/** "diagnosis" to "PROBLEM"; blank to "". */
	public static String normalizeType(String label) {
		if (label == null || label.isEmpty()) {
			return "";
		}
		String upper = label.toUpperCase(Locale.ROOT).strip();
		return LABEL_MAP.getOrDefault(upper, upper);
	}

	/** Upper-case and trim; blank becomes {@code null}. */
	public static String normalizeAssertion(String assertion) {
		if (assertion == null || assertion.isEmpty()) {
			return null;
		}
		return assertion.toUpperCase(Locale.ROOT).strip();
	}
}
