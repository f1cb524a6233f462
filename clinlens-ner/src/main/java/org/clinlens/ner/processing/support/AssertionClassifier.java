package org.clinlens.ner.processing.support;

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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.clinlens.ner.om.Assertion;
import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.util.TermNormalizer;

/**
 * Rule-based assertion status from the left context of an entity.
 * <p>
 * The 60 characters before the entity (lowercased, whitespace collapsed) are
 * cut after the last scope breaker, so in "sem febre, porém refere cefaleia"
 * the "sem" does not reach "cefaleia". Any negation trigger left in the window
 * gives NEGATED, then uncertainty gives POSSIBLE, then history gives
 * HISTORICAL; otherwise PRESENT.
 */
public final class AssertionClassifier {

	static final int LEFT_WINDOW_CHARS = 60;

	private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
			| Pattern.UNICODE_CHARACTER_CLASS;

	private static final Pattern BREAKERS = Pattern.compile(
			"(\\.|;|:|\\n|\\bmas\\b|\\bpor[eé]m\\b|\\bcontudo\\b|\\bentretanto\\b|\\bno entanto\\b|\\btodavia\\b|\\bpor outro lado\\b)",
			FLAGS);

	private static final List<Pattern> NEGATION = compile(
			"\\bnega(?:ndo|do|)\\b",
			"\\bnegou\\b",
			"\\bnegava\\b",
			"\\bnega\\s+queix(?:a|as)\\b",
			"\\bnega\\s+sintomas?\\b",
			"\\bnega\\s+(?:dor|febre|dispneia|vomitos?|n[aã]useas?)\\b",
			"\\bsem\\b",
			"\\bsem\\s+sinais?\\s+de\\b",
			"\\bsem\\s+evid[eê]ncia\\s+de\\b",
			"\\bsem\\s+queixas?\\s+de\\b",
			"\\bn[aã]o\\b",
			"\\bn[aã]o\\s+(apresenta|refere|relata|tem|possui|evidencia)\\b",
			"\\bn[aã]o\\s+houve\\b",
			"\\bn[aã]o\\s+nega\\b",
			"\\bausent[ea]s?\\b",
			"\\binexistente\\b",
			"\\bnega(?:tivo|tiva|)\\b");

	private static final List<Pattern> POSSIBLE = compile(
			"\\bsuspeit[ae]\\b",
			"\\bhip[oó]teses?\\b",
			"\\bprov[aá]vel\\b",
			"\\bposs[ií]vel\\b",
			"\\bcompat[ií]vel\\s+com\\b",
			"\\ba\\s+esclarecer\\b",
			"\\ba\\s+confirmar\\b",
			"\\bdiferencial\\b",
			"\\bddx\\b",
			// question mark closing the left context
			"\\?\\s*$");

	private static final List<Pattern> HISTORICAL = compile(
			"\\bhist[oó]ria\\s+de\\b",
			"\\bantecedentes?\\b",
			"\\bantecedentes?\\s+pessoais\\b",
			"\\bhpp\\b",
			"\\bap\\s*:\\b",
			"\\baf\\s*:\\b",
			"\\bpreviamente\\b",
			"\\banteriormente\\b",
			"\\bpr[eé]vio\\b");

	private AssertionClassifier() {
	}

	/**
	 * @param sentence sentence text
	 * @param start    entity start relative to the sentence
	 * @param end      entity end relative to the sentence
	 * @param type     entity type; ANATOMY is always PRESENT
	 */
	public static Assertion classify(String sentence, Integer start, Integer end, EntityType type) {
		if (type == EntityType.ANATOMY) {
			return Assertion.PRESENT;
		}
		if (sentence == null || sentence.isEmpty() || start == null || end == null) {
			return Assertion.PRESENT;
		}
		int s = Math.max(0, Math.min(start, sentence.length()));

		String lowered = TermNormalizer.lowerCollapse(sentence);
		int to = Math.min(s, lowered.length());
		String left = cutAfterLastBreaker(lowered.substring(Math.max(0, to - LEFT_WINDOW_CHARS), to));

		if (anyMatch(left, NEGATION)) {
			return Assertion.NEGATED;
		}
		if (anyMatch(left, POSSIBLE)) {
			return Assertion.POSSIBLE;
		}
		if (anyMatch(left, HISTORICAL)) {
			return Assertion.HISTORICAL;
		}
		return Assertion.PRESENT;
	}

	static String cutAfterLastBreaker(String left) {
		Matcher m = BREAKERS.matcher(left);
		int lastEnd = -1;
		while (m.find()) {
			lastEnd = m.end();
		}
		return lastEnd < 0 ? left : left.substring(lastEnd).strip();
	}

	private static boolean anyMatch(String text, List<Pattern> patterns) {
		for (Pattern p : patterns) {
			if (p.matcher(text).find()) {
				return true;
			}
		}
		return false;
	}

	private static List<Pattern> compile(String... regexes) {
		List<Pattern> out = new ArrayList<>(regexes.length);
		for (String r : regexes) {
			out.add(Pattern.compile(r, FLAGS));
		}
		return List.copyOf(out);
	}
}
