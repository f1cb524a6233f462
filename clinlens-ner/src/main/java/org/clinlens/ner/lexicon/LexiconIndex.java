package org.clinlens.ner.lexicon;

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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.util.Logger;
import org.clinlens.ner.util.TermNormalizer;

/**
 * Token index over a static term list.
 * <p>
 * Built once from an ordered list of (term, type) pairs and never mutated
 * afterwards, so one instance can be shared by any number of document
 * workers. The first term seen for a given normalized form wins; later
 * duplicates are dropped. Terms that normalize to nothing are skipped.
 */
public final class LexiconIndex {

	private final List<LexiconEntry> entries;
	private final Map<String, List<Integer>> tokenToEntries;
	private final List<LexiconEntry> singleTokenEntries;
	private final List<LexiconEntry> multiTokenEntries;
	// Word-boundary confirmation for single-token entries, compiled once
	private final Map<String, Pattern> singleTokenPatterns;

	/**
	 * @param lexicon ordered (term, type) pairs; earlier pairs take precedence
	 */
	public LexiconIndex(List<Map.Entry<String, EntityType>> lexicon) {
		List<LexiconEntry> all = new ArrayList<>();
		Map<String, List<Integer>> byToken = new HashMap<>();
		List<LexiconEntry> single = new ArrayList<>();
		List<LexiconEntry> multi = new ArrayList<>();
		Map<String, Pattern> patterns = new HashMap<>();
		Set<String> seen = new HashSet<>();
		int duplicates = 0;

		if (lexicon != null) {
			for (Map.Entry<String, EntityType> pair : lexicon) {
				String term = pair.getKey();
				String normalized = TermNormalizer.normalize(term);
				if (normalized.isEmpty()) {
					Logger.debug("Skipping lexicon term with empty normalized form: '{}'", term);
					continue;
				}
				if (!seen.add(normalized)) {
					duplicates++;
					continue;
				}
				List<String> tokens = List.copyOf(TermNormalizer.tokens(normalized));
				LexiconEntry entry = new LexiconEntry(term, normalized, tokens, pair.getValue());

				int idx = all.size();
				all.add(entry);
				for (String token : tokens) {
					byToken.computeIfAbsent(token, k -> new ArrayList<>()).add(idx);
				}
				if (entry.isSingleToken()) {
					single.add(entry);
					patterns.computeIfAbsent(tokens.get(0), LexiconIndex::wordPattern);
				} else {
					multi.add(entry);
				}
			}
		}
		if (duplicates > 0) {
			Logger.debug("Lexicon index dropped {} duplicate normalized terms", duplicates);
		}

		this.entries = Collections.unmodifiableList(all);
		this.tokenToEntries = Collections.unmodifiableMap(byToken);
		this.singleTokenEntries = Collections.unmodifiableList(single);
		this.multiTokenEntries = Collections.unmodifiableList(multi);
		this.singleTokenPatterns = Collections.unmodifiableMap(patterns);
	}

	// ---- Queries ----

	/**
	 * Exact and token candidates for one sentence.
	 * <ol>
	 * <li>multi-token entries whose normalized form occurs in the sentence:
	 * {@link CandidateMatchType#EXACT}</li>
	 * <li>single-token entries whose token is a sentence token and a whole word of
	 * the sentence: {@link CandidateMatchType#TOKEN}</li>
	 * <li>multi-token entries whose tokens are all sentence tokens and whose form
	 * occurs in the sentence, unless already found as EXACT:
	 * {@link CandidateMatchType#TOKEN}</li>
	 * </ol>
	 *
	 * @param sentenceNorm   normalized sentence
	 * @param sentenceTokens tokens of the normalized sentence
	 */
	public List<MatchCandidate> findCandidates(String sentenceNorm, List<String> sentenceTokens) {
		List<MatchCandidate> candidates = new ArrayList<>();
		if (entries.isEmpty() || sentenceNorm == null) {
			return candidates;
		}
		String sentenceLower = sentenceNorm.toLowerCase(java.util.Locale.ROOT);
		Set<String> tokenSet = new HashSet<>(sentenceTokens);
		Set<String> exactTerms = new HashSet<>();

		for (LexiconEntry entry : multiTokenEntries) {
			if (sentenceLower.contains(entry.getNormalizedTerm())) {
				candidates.add(MatchCandidate.of(entry, CandidateMatchType.EXACT));
				exactTerms.add(entry.getNormalizedTerm());
			}
		}

		for (LexiconEntry entry : singleTokenEntries) {
			String token = entry.getTokens().get(0);
			if (tokenSet.contains(token) && singleTokenPatterns.get(token).matcher(sentenceLower).find()) {
				candidates.add(MatchCandidate.of(entry, CandidateMatchType.TOKEN));
			}
		}

		for (LexiconEntry entry : multiTokenEntries) {
			if (tokenSet.containsAll(entry.getTokens()) && sentenceLower.contains(entry.getNormalizedTerm())
					&& !exactTerms.contains(entry.getNormalizedTerm())) {
				candidates.add(MatchCandidate.of(entry, CandidateMatchType.TOKEN));
			}
		}
		return candidates;
	}

	/**
	 * Fuzzy seeds: entries sharing at least one token with the sentence whose
	 * normalized form is not already a substring of it. Returns nothing when
	 * {@code existing} is non-empty. Does not score.
	 */
	public List<MatchCandidate> findFuzzyCandidates(String sentenceNorm, List<String> sentenceTokens,
			List<MatchCandidate> existing) {
		if (existing != null && !existing.isEmpty()) {
			return Collections.emptyList();
		}
		List<MatchCandidate> fuzzy = new ArrayList<>();
		if (entries.isEmpty() || sentenceNorm == null) {
			return fuzzy;
		}
		String sentenceLower = sentenceNorm.toLowerCase(java.util.Locale.ROOT);
		Set<Integer> checked = new LinkedHashSet<>();

		for (String token : sentenceTokens) {
			List<Integer> ids = tokenToEntries.get(token);
			if (ids == null) {
				continue;
			}
			for (int idx : ids) {
				if (!checked.add(idx)) {
					continue;
				}
				LexiconEntry entry = entries.get(idx);
				if (sentenceLower.contains(entry.getNormalizedTerm())) {
					continue;
				}
				fuzzy.add(MatchCandidate.of(entry, CandidateMatchType.FUZZY));
			}
		}
		return fuzzy;
	}

	// ---- Accessors ----

	public List<LexiconEntry> getEntries() {
		return entries;
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/** Entry indices that contain {@code token}; empty when unknown. */
	public List<Integer> entriesWithToken(String token) {
		return tokenToEntries.getOrDefault(token, Collections.emptyList());
	}

	public List<LexiconEntry> getSingleTokenEntries() {
		return singleTokenEntries;
	}

	public List<LexiconEntry> getMultiTokenEntries() {
		return multiTokenEntries;
	}

	private static Pattern wordPattern(String token) {
		return Pattern.compile("\\b" + Pattern.quote(token) + "\\b", Pattern.UNICODE_CHARACTER_CLASS);
	}
}
