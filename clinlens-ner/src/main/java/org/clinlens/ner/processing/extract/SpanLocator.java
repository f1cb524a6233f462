package org.clinlens.ner.processing.extract;

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

import org.clinlens.ner.util.TermNormalizer;

/**
 * Offset helpers shared by the extractors: mapping a match found in
 * normalized text back into the original (accented, punctuated) text, and
 * snapping raw offsets to whole-word boundaries.
 */
public final class SpanLocator {

	// Search slack around the normalized position, in characters
	private static final int LOOK_BEHIND = 10;
	private static final int LOOK_AHEAD = 20;
	// Window sizes tried: pattern length - 2 .. pattern length + 4
	private static final int WINDOW_SHRINK = 2;
	private static final int WINDOW_GROW = 5;

	private SpanLocator() {
	}

	/**
	 * Locate {@code normalizedPattern} in {@code original}.
	 * <p>
	 * The pattern is first found in {@code normalized}; windows of the original
	 * text around that position are normalized and compared with the pattern.
	 * A window validates only when its normalized form equals the whole pattern
	 * and both of its boundary characters survive normalization, so the offsets
	 * never include a leading space or a stray bracket. A window of exactly the
	 * pattern's length beats a longer or shorter one; among equals the one
	 * starting nearest the normalized position wins.
	 *
	 * @param original          original text (usually one sentence)
	 * @param normalized        {@link TermNormalizer#normalize(String)} of
	 *                          {@code original}
	 * @param normalizedPattern normalized term to locate
	 * @param offset            added to the returned offsets (the sentence
	 *                          start in the document)
	 */
	public static SpanLocation locate(String original, String normalized, String normalizedPattern, int offset) {
		if (original == null || normalized == null || normalizedPattern == null || normalizedPattern.isEmpty()) {
			return SpanLocation.notFound();
		}
		int normIdx = normalized.indexOf(normalizedPattern);
		if (normIdx == -1) {
			return SpanLocation.notFound();
		}

		String pattern = normalizedPattern.toLowerCase(Locale.ROOT);
		int patternLen = normalizedPattern.length();
		int searchStart = Math.max(0, normIdx - LOOK_BEHIND);
		int searchEnd = Math.min(original.length(), normIdx + patternLen + LOOK_AHEAD);

		int[] best = null;
		double bestScore = 0;
		int bestDistance = Integer.MAX_VALUE;

		for (int i = searchStart; i < searchEnd; i++) {
			if (!survivesNormalization(original.charAt(i))) {
				continue;
			}
			for (int size = Math.max(1, patternLen - WINDOW_SHRINK); size < patternLen + WINDOW_GROW; size++) {
				if (i + size > original.length()) {
					break;
				}
				if (!survivesNormalization(original.charAt(i + size - 1))) {
					continue;
				}
				String windowNorm = TermNormalizer.normalize(original.substring(i, i + size));
				if (!windowNorm.equals(pattern)) {
					continue;
				}
				double score = size == patternLen ? 1.0 : 0.8;
				int distance = Math.abs(i - normIdx);
				if (score > bestScore || (score == bestScore && distance < bestDistance)) {
					bestScore = score;
					bestDistance = distance;
					best = new int[] { offset + i, offset + i + size };
				}
			}
		}

		if (best != null) {
			return SpanLocation.exact(best[0], best[1]);
		}
		return SpanLocation.approximate(offset + normIdx, offset + normIdx + patternLen);
	}

	/**
	 * Snap a raw span to word boundaries: clamp to the text, trim every
	 * character that is not a letter or digit from both ends, then grow both ends over adjacent letters
	 * and digits. "febre," becomes "febre"; "febr" inside "febre alta" becomes
	 * "febre". Applying it to its own output returns the same offsets.
	 *
	 * @return {@code {start, end}}, or {@code null} when nothing is left
	 */
	public static int[] normalizeSpan(String text, int start, int end) {
		if (text == null) {
			return null;
		}
		int n = text.length();
		int s = Math.max(0, Math.min(start, n));
		int e = Math.max(0, Math.min(end, n));
		if (s >= e) {
			return null;
		}

		while (s < e && !Character.isLetterOrDigit(text.charAt(s))) {
			s++;
		}
		while (e > s && !Character.isLetterOrDigit(text.charAt(e - 1))) {
			e--;
		}
		if (s >= e) {
			return null;
		}

		while (s > 0 && Character.isLetterOrDigit(text.charAt(s - 1))) {
			s--;
		}
		while (e < n && Character.isLetterOrDigit(text.charAt(e))) {
			e++;
		}
		return new int[] { s, e };
	}

	private static boolean survivesNormalization(char c) {
		return Character.isLetterOrDigit(c) || c == '-';
	}
}
