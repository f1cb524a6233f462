package org.clinlens.ner.util;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Text normalization shared by the lexicon index, the span matcher and the
 * entity filter. Normalized text is lowercase, accent-free, whitespace
 * collapsed and stripped of punctuation other than hyphens.
 */
public final class TermNormalizer {

	private static final Pattern WS = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
	private static final Pattern NOT_WORD_SPACE_HYPHEN = Pattern.compile("[^\\w\\s-]",
			Pattern.UNICODE_CHARACTER_CLASS);

	private TermNormalizer() {
	}

	/**
	 * Lowercase, fold diacritics, collapse whitespace, strip punctuation except
	 * hyphens and trim. Whitespace is collapsed before punctuation is removed, so
	 * "dor , febre" keeps two spaces between the words.
	 */
	public static String normalize(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		String out = fold(text.toLowerCase(Locale.ROOT));
		out = WS.matcher(out).replaceAll(" ");
		out = NOT_WORD_SPACE_HYPHEN.matcher(out).replaceAll("");
		return out.strip();
	}

	/** Whitespace tokens of already normalized text. */
	public static List<String> tokens(String normalized) {
		if (normalized == null || normalized.isBlank()) {
			return Collections.emptyList();
		}
		List<String> out = new ArrayList<>();
		for (String t : WS.split(normalized.strip())) {
			if (!t.isEmpty()) {
				out.add(t);
			}
		}
		return out;
	}

	/** Diacritic folding ("náusea" to "nausea", "ção" to "cao"). */
	public static String fold(String text) {
		return text == null ? "" : StringUtils.stripAccents(text);
	}

	/** Key used to detect duplicate terms while loading lexicon files. */
	public static String dedupKey(String term) {
		return term == null ? "" : fold(term.toLowerCase(Locale.ROOT).strip());
	}

	/**
	 * True when the text has at least one cased character and no lowercase
	 * ones. Digits and punctuation do not count either way ("A09" is upper
	 * case, "09" is not).
	 */
	public static boolean isUpperCase(String text) {
		if (text == null) {
			return false;
		}
		boolean cased = false;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (Character.isLowerCase(c)) {
				return false;
			}
			if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
				cased = true;
			}
		}
		return cased;
	}

	/** Lowercase and collapse whitespace; used by the left-context assertion rules. */
	public static String lowerCollapse(String text) {
		if (text == null) {
			return "";
		}
		return WS.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
	}
}
