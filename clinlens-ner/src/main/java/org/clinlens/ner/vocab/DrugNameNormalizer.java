package org.clinlens.ner.vocab;

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
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces a drug product name to its active ingredient for loose matching:
 * "PARACETAMOL 500MG COMPRIMIDO" becomes "paracetamol".
 */
public final class DrugNameNormalizer {

	/** Names shorter than this are too ambiguous to match on. */
	public static final int MIN_LENGTH = 4;

	// Strength with unit: 500mg, 20 ml, 1000UI
	private static final Pattern STRENGTH = Pattern.compile("\\d+\\s*(mg|g|ml|mcg|ui)");

	// Pharmaceutical forms, with and without accents
	private static final Pattern FORMS = Pattern.compile(
			"(comprimido|capsula|solucao|ampola|frasco|suspensao|creme|pomada|dragea|xarope|solução|cápsula|drágea)");

	private static final Pattern WS = Pattern.compile("\\s+");

	private static final Set<String> CONNECTORS = Set.of("de", "da", "do", "com", "em", "a", "o", "e", "para",
			"por");

	private DrugNameNormalizer() {
	}

	/**
	 * @return lowercase active ingredient, or an empty string when nothing of at
	 *         least {@link #MIN_LENGTH} characters is left
	 */
	public static String normalize(String name) {
		if (name == null || name.isEmpty()) {
			return "";
		}
		String out = name.toLowerCase(Locale.ROOT);
		out = STRENGTH.matcher(out).replaceAll("");
		out = FORMS.matcher(out).replaceAll("");

		for (String word : WS.split(out.strip())) {
			if (word.isEmpty() || CONNECTORS.contains(word)) {
				continue;
			}
			return word.length() < MIN_LENGTH ? "" : word;
		}
		return "";
	}
}
