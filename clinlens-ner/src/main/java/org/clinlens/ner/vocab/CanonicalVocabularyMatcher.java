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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.processing.resolve.ConfidenceSweepOverlapResolver;
import org.clinlens.ner.processing.resolve.OverlapResolver;
import org.clinlens.ner.util.TermNormalizer;

import lombok.Getter;

/**
 * Exact matching of canonical vocabulary entries against a document.
 * <p>
 * Two passes feed one confidence-first overlap sweep:
 * <ol>
 * <li>every indexed entry text is searched, as a whole word, in the uppercased
 * document; short and function-word hits are filtered by
 * {@link #shouldSkip}</li>
 * <li>normalized drug names are searched in the lowercased document, with an
 * optional trailing strength such as "500 mg"</li>
 * </ol>
 * Entries marked {@code context_required} only get a lower confidence; no
 * context disambiguation is attempted.
 */
public class CanonicalVocabularyMatcher {

	/** Words never accepted as a vocabulary hit on their own. */
	public static final Set<String> PORTUGUESE_STOPWORDS = Set.of("a", "o", "e", "de", "da", "do", "em", "na",
			"no", "para", "por", "com", "sem", "sob", "sobre", "ou", "mas", "se", "ao", "aos", "as", "os", "um",
			"uma", "uns", "umas", "que", "qual");

	static final double CONTEXT_REQUIRED_CONFIDENCE = 0.50;
	static final double OFFICIAL_CONFIDENCE = 0.95;
	static final double CODE_CONFIDENCE = 0.90;
	static final double ABBR_CONFIDENCE = 0.85;
	static final double DEFAULT_CONFIDENCE = 0.80;
	static final double DRUG_CONFIDENCE = 0.85;

	static final String MATCH_EXACT = "exact";
	static final String MATCH_NORMALIZED = "normalized";
	static final String DRUG_VOCABULARY = "TUSS_DRUG";

	private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

	@Getter
	private final CanonicalVocabulary vocabulary;
	private final OverlapResolver<CanonicalMatch> resolver = new ConfidenceSweepOverlapResolver<>();
	// Both pattern maps follow the index order
	private final Map<String, Pattern> entryPatterns;
	private final Map<String, Pattern> drugPatterns;

	public CanonicalVocabularyMatcher(CanonicalVocabulary vocabulary) {
		this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");

		Map<String, Pattern> entries = new LinkedHashMap<>();
		for (String key : vocabulary.getEntryIndex().keySet()) {
			entries.put(key, Pattern.compile("\\b" + Pattern.quote(key) + "\\b", FLAGS));
		}
		Map<String, Pattern> drugs = new LinkedHashMap<>();
		for (String name : vocabulary.getDrugIndex().keySet()) {
			if (name.length() < DrugNameNormalizer.MIN_LENGTH || PORTUGUESE_STOPWORDS.contains(name)) {
				continue;
			}
			drugs.put(name, Pattern.compile(
					"\\b" + Pattern.quote(name) + "(?:\\s+\\d+\\s*(?:mg|g|ml|mcg|ui))?\\b", FLAGS));
		}
		this.entryPatterns = Collections.unmodifiableMap(entries);
		this.drugPatterns = Collections.unmodifiableMap(drugs);
	}

	public List<CanonicalMatch> matchText(String text) {
		return matchText(text, null);
	}

	/**
	 * @param text        document text
	 * @param entityTypes restrict to these concept types; {@code null} or empty
	 *                    for all
	 * @return non-overlapping matches ordered by start
	 */
	public List<CanonicalMatch> matchText(String text, Set<EntityType> entityTypes) {
		if (text == null || text.isEmpty()) {
			return new ArrayList<>();
		}
		boolean filtered = entityTypes != null && !entityTypes.isEmpty();
		List<CanonicalMatch> matches = new ArrayList<>();

		String upper = sameLengthCase(text, true);
		for (Map.Entry<String, Pattern> e : entryPatterns.entrySet()) {
			String entryText = e.getKey();
			Matcher m = e.getValue().matcher(upper);
			while (m.find()) {
				int start = m.start();
				int end = m.end();
				String original = text.substring(start, end);
				for (VocabEntry entry : vocabulary.getEntryIndex().get(entryText)) {
					if (shouldSkip(entryText, entry, original)) {
						continue;
					}
					Concept concept = vocabulary.getConcept(entry.getConceptId());
					if (concept == null) {
						continue;
					}
					if (filtered && !entityTypes.contains(concept.getEntityType())) {
						continue;
					}
					matches.add(new CanonicalMatch(original, concept.getConceptId(), concept.getConceptName(),
							concept.getEntityType(), concept.getVocabulary(), MATCH_EXACT,
							entry.getMatchPolicy().label(), entry.getEntryType().label(), confidence(entry), start,
							end));
				}
			}
		}

		if (!filtered || entityTypes.contains(EntityType.DRUG)) {
			matchDrugs(text, matches);
		}

		matches.sort(Comparator.comparingInt(CanonicalMatch::getStart));
		return resolver.resolve(matches);
	}

	private void matchDrugs(String text, List<CanonicalMatch> out) {
		String lower = sameLengthCase(text, false);
		for (Map.Entry<String, Pattern> e : drugPatterns.entrySet()) {
			Matcher m = e.getValue().matcher(lower);
			while (m.find()) {
				int start = m.start();
				int end = m.end();
				for (String conceptId : vocabulary.getDrugIndex().get(e.getKey())) {
					Concept concept = vocabulary.getConcept(conceptId);
					if (concept == null) {
						continue;
					}
					out.add(new CanonicalMatch(text.substring(start, end), concept.getConceptId(),
							concept.getConceptName(), EntityType.DRUG, DRUG_VOCABULARY, MATCH_NORMALIZED,
							MatchPolicy.SAFE_EXACT.label(), EntryType.DRUG_NORMALIZED.label(), DRUG_CONFIDENCE,
							start, end));
				}
			}
		}
	}

	/**
	 * Policy for hits that are too short or too common to trust.
	 * <ul>
	 * <li>codes always pass</li>
	 * <li>one-character entries never pass</li>
	 * <li>stopwords never pass</li>
	 * <li>two-character entries pass only as abbreviations written fully in
	 * uppercase in the document ("EM" passes, "em" does not)</li>
	 * </ul>
	 *
	 * @param entryText    uppercase entry text
	 * @param entry        entry record
	 * @param originalText matched substring of the document, original case
	 */
	public static boolean shouldSkip(String entryText, VocabEntry entry, String originalText) {
		if (entry.getEntryType() == EntryType.CODE) {
			return false;
		}
		int length = entryText.length();
		if (length == 1) {
			return true;
		}
		if (PORTUGUESE_STOPWORDS.contains(entryText.toLowerCase(java.util.Locale.ROOT))) {
			return true;
		}
		if (length == 2) {
			return !(entry.getEntryType() == EntryType.ABBR && TermNormalizer.isUpperCase(originalText));
		}
		return false;
	}

	/** Confidence by policy first, then by entry type. */
	public static double confidence(VocabEntry entry) {
		if (entry.getMatchPolicy() == MatchPolicy.CONTEXT_REQUIRED) {
			return CONTEXT_REQUIRED_CONFIDENCE;
		}
		switch (entry.getEntryType()) {
		case OFFICIAL:
			return OFFICIAL_CONFIDENCE;
		case CODE:
			return CODE_CONFIDENCE;
		case ABBR:
			return ABBR_CONFIDENCE;
		default:
			return DEFAULT_CONFIDENCE;
		}
	}

	// Per-char case mapping keeps offsets valid for characters whose full
	// mapping would change the string length
	private static String sameLengthCase(String text, boolean upper) {
		char[] chars = text.toCharArray();
		for (int i = 0; i < chars.length; i++) {
			chars[i] = upper ? Character.toUpperCase(chars[i]) : Character.toLowerCase(chars[i]);
		}
		return new String(chars);
	}
}
