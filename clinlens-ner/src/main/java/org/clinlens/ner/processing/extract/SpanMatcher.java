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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;

import org.clinlens.ner.lexicon.CandidateMatchType;
import org.clinlens.ner.lexicon.LexiconIndex;
import org.clinlens.ner.lexicon.MatchCandidate;
import org.clinlens.ner.om.EntitySpan;
import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.om.Evidence;
import org.clinlens.ner.om.Sentence;
import org.clinlens.ner.processing.extract.ClinicalPatterns.PatternDef;
import org.clinlens.ner.processing.resolve.LengthScoreOverlapResolver;
import org.clinlens.ner.processing.resolve.OverlapResolver;
import org.clinlens.ner.util.TermNormalizer;

import lombok.Getter;
import me.xdrop.fuzzywuzzy.FuzzySearch;

/**
 * Lexicon-driven baseline extractor.
 * <p>
 * Per sentence, three layers run in order:
 * <ol>
 * <li>regular expressions from {@link ClinicalPatterns} on the raw sentence</li>
 * <li>exact and token lexicon candidates, located back in the original
 * text</li>
 * <li>fuzzy candidates scored with partial-ratio similarity, only when the
 * first two layers found nothing in the sentence</li>
 * </ol>
 * Hits are snapped to word boundaries, deduplicated on (start, end, type)
 * keeping the best score, and passed through an {@link OverlapResolver}.
 * <p>
 * Instances hold no per-call state and may be shared across threads.
 */
public class SpanMatcher implements EntityExtractor {

	public static final int DEFAULT_MIN_FUZZY = 90;
	static final double EXACT_SCORE = 0.99;
	static final double TOKEN_SCORE = 0.95;

	@Getter
	private final LexiconIndex index;
	private final List<PatternDef> patterns;
	private final OverlapResolver<EntitySpan> resolver;
	@Getter
	private final boolean fuzzyEnabled;
	@Getter
	private final int minFuzzy;

	public SpanMatcher(LexiconIndex index) {
		this(index, ClinicalPatterns.DEFAULT, new LengthScoreOverlapResolver<>(), true, DEFAULT_MIN_FUZZY);
	}

	public SpanMatcher(LexiconIndex index, boolean enableFuzzy, int minFuzzy) {
		this(index, ClinicalPatterns.DEFAULT, new LengthScoreOverlapResolver<>(), enableFuzzy, minFuzzy);
	}

	public SpanMatcher(LexiconIndex index, List<PatternDef> patterns, OverlapResolver<EntitySpan> resolver,
			boolean enableFuzzy, int minFuzzy) {
		this.index = Objects.requireNonNull(index, "index");
		this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
		this.resolver = Objects.requireNonNull(resolver, "resolver");
		this.fuzzyEnabled = enableFuzzy;
		if (minFuzzy < 0 || minFuzzy > 100) {
			throw new IllegalArgumentException("minFuzzy must be within 0..100, got " + minFuzzy);
		}
		this.minFuzzy = minFuzzy;
	}

	@Override
	public List<EntitySpan> extract(String text, List<Sentence> sentences) {
		if (text == null || text.isEmpty() || sentences == null || sentences.isEmpty()) {
			return new ArrayList<>();
		}

		List<EntitySpan> results = new ArrayList<>();
		for (Sentence sentence : sentences) {
			int before = results.size();
			matchPatterns(text, sentence, results);
			boolean anyLexical = matchLexicon(text, sentence, results);
			if (fuzzyEnabled && !anyLexical && results.size() == before) {
				matchFuzzy(text, sentence, results);
			}
		}

		Map<String, EntitySpan> unique = new LinkedHashMap<>();
		for (EntitySpan span : results) {
			String key = span.getStart() + ":" + span.getEnd() + ":" + span.getType();
			EntitySpan current = unique.get(key);
			if (current == null || span.getScore() > current.getScore()) {
				unique.put(key, span);
			}
		}
		return resolver.resolve(new ArrayList<>(unique.values()));
	}

	// ---- Layer 1: patterns ----

	private void matchPatterns(String text, Sentence sentence, List<EntitySpan> out) {
		String sentText = sentence.getText();
		for (PatternDef def : patterns) {
			Matcher m = def.getPattern().matcher(sentText);
			while (m.find()) {
				add(text, sentence, sentence.getStart() + m.start(), sentence.getStart() + m.end(), def.getType(),
						def.getScore(), out);
			}
		}
	}

	// ---- Layer 2: exact and token candidates ----

	/** @return whether the index produced any exact or token candidate */
	private boolean matchLexicon(String text, Sentence sentence, List<EntitySpan> out) {
		String sentText = sentence.getText();
		String sentNorm = TermNormalizer.normalize(sentText);
		List<String> tokens = TermNormalizer.tokens(sentNorm);
		int ss = sentence.getStart();
		int se = sentence.getEnd();

		List<MatchCandidate> candidates = index.findCandidates(sentNorm, tokens);
		for (MatchCandidate cand : candidates) {
			SpanLocation loc = SpanLocator.locate(sentText, sentNorm, cand.getNormalizedTerm(), ss);
			if (!loc.isFound()) {
				continue;
			}
			int start = Math.max(ss, loc.getStart());
			int end = Math.min(se, loc.getEnd());
			double score = cand.getMatchType() == CandidateMatchType.EXACT ? EXACT_SCORE : TOKEN_SCORE;
			add(text, sentence, start, end, cand.getEntityType(), score, out);
		}
		return !candidates.isEmpty();
	}

	// ---- Layer 3: fuzzy ----

	private void matchFuzzy(String text, Sentence sentence, List<EntitySpan> out) {
		String sentText = sentence.getText();
		String sentNorm = TermNormalizer.normalize(sentText);
		List<String> tokens = TermNormalizer.tokens(sentNorm);
		int ss = sentence.getStart();
		int se = sentence.getEnd();

		for (MatchCandidate cand : index.findFuzzyCandidates(sentNorm, tokens, List.of())) {
			String term = cand.getNormalizedTerm();
			int n = cand.getTokens().size();
			int best = 0;
			Integer bestStart = null;
			Integer bestEnd = null;

			if (n > 0 && tokens.size() >= n) {
				for (int i = 0; i + n <= tokens.size(); i++) {
					String window = String.join(" ", tokens.subList(i, i + n));
					int score = FuzzySearch.partialRatio(term, window);
					if (score > best) {
						best = score;
						int pos = sentNorm.indexOf(window);
						if (pos != -1) {
							bestStart = ss + pos;
							bestEnd = Math.min(se, bestStart + window.length());
						}
					}
				}
			}

			int whole = FuzzySearch.partialRatio(term, sentNorm);
			if (whole > best) {
				best = whole;
				SpanLocation loc = SpanLocator.locate(sentText, sentNorm, term, ss);
				if (loc.isFound()) {
					bestStart = loc.getStart();
					bestEnd = loc.getEnd();
				}
			}

			if (best >= minFuzzy && bestStart != null) {
				add(text, sentence, bestStart, bestEnd, cand.getEntityType(), best / 100.0, out);
			}
		}
	}

	private static void add(String text, Sentence sentence, int start, int end, EntityType type, double score,
			List<EntitySpan> out) {
		int[] snapped = SpanLocator.normalizeSpan(text, start, end);
		if (snapped == null) {
			return;
		}
		out.add(new EntitySpan(text.substring(snapped[0], snapped[1]), snapped[0], snapped[1], type, score,
				sentence.getStart(), sentence.getEnd(), Evidence.ofSentence(sentence.getText().strip())));
	}
}
