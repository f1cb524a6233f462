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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.clinlens.ner.om.Assertion;

/**
 * Aggregates match results into NER, assertion, coverage and error figures.
 */
public final class MetricsCalculator {

	/** Confusion matrix labels, in report order. */
	public static final List<String> ASSERTION_LABELS = List.of("PRESENT", "NEGATED", "POSSIBLE", "HISTORICAL");

	public static final int DEFAULT_MAX_EXAMPLES = 10;
	static final int TOP_TEXTS = 20;
	static final int CONTEXT_WINDOW = 50;
	static final int CONTEXT_FALLBACK_CHARS = 120;

	private static final String PRESENT = "PRESENT";

	private MetricsCalculator() {
	}

	public static PrfScore overall(MatchResult result) {
		return PrfScore.of(result.getMatches().size(), result.getUnmatchedPred().size(),
				result.getUnmatchedGold().size());
	}

	/**
	 * Per type scores. True positives and false negatives count under the gold
	 * type, false positives under the predicted type.
	 */
	public static Map<String, PrfScore> perType(MatchResult result) {
		Map<String, Integer> tp = new HashMap<>();
		Map<String, Integer> fp = new HashMap<>();
		Map<String, Integer> fn = new HashMap<>();
		for (EntityMatch m : result.getMatches()) {
			tp.merge(m.getGold().getType(), 1, Integer::sum);
		}
		for (PredEntity p : result.getUnmatchedPred()) {
			fp.merge(p.getType(), 1, Integer::sum);
		}
		for (GoldEntity g : result.getUnmatchedGold()) {
			fn.merge(g.getType(), 1, Integer::sum);
		}
		TreeSet<String> types = new TreeSet<>(tp.keySet());
		types.addAll(fp.keySet());
		types.addAll(fn.keySet());

		Map<String, PrfScore> out = new TreeMap<>();
		for (String type : types) {
			out.put(type, PrfScore.of(tp.getOrDefault(type, 0), fp.getOrDefault(type, 0), fn.getOrDefault(type, 0)));
		}
		return out;
	}

	/**
	 * Assertion accuracy and confusion over matched pairs. Missing or unknown
	 * labels count as PRESENT.
	 */
	public static AssertionMetrics assertion(List<EntityMatch> matches) {
		Map<String, Map<String, Integer>> matrix = new LinkedHashMap<>();
		for (String gold : ASSERTION_LABELS) {
			Map<String, Integer> row = new LinkedHashMap<>();
			for (String pred : ASSERTION_LABELS) {
				row.put(pred, 0);
			}
			matrix.put(gold, row);
		}
		int correct = 0;
		for (EntityMatch m : matches) {
			String gold = canonicalAssertion(m.getGold().getAssertion());
			String pred = canonicalAssertion(m.getPred().getAssertion());
			matrix.get(gold).merge(pred, 1, Integer::sum);
			if (gold.equals(pred)) {
				correct++;
			}
		}
		int total = matches.size();
		return new AssertionMetrics(total > 0 ? (double) correct / total : 0.0, matrix, total);
	}

	/**
	 * Coverage over every predicted case, aligned or not.
	 */
	public static CoverageMetrics coverage(List<PredCase> predCases) {
		int total = predCases.size();
		int withEntities = 0;
		int entityCount = 0;
		Map<String, Integer> types = new LinkedHashMap<>();
		Map<String, Integer> texts = new LinkedHashMap<>();
		for (PredCase c : predCases) {
			if (!c.getEntities().isEmpty()) {
				withEntities++;
			}
			entityCount += c.getEntities().size();
			for (PredEntity e : c.getEntities()) {
				types.merge(e.getType(), 1, Integer::sum);
				texts.merge(e.getSpan().strip(), 1, Integer::sum);
			}
		}

		// Stable sort keeps first-seen order among equal counts
		List<Map.Entry<String, Integer>> ranked = new ArrayList<>(texts.entrySet());
		ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
		List<CoverageMetrics.TextCount> top = new ArrayList<>();
		for (Map.Entry<String, Integer> e : ranked.subList(0, Math.min(TOP_TEXTS, ranked.size()))) {
			top.add(new CoverageMetrics.TextCount(e.getKey(), e.getValue()));
		}

		double pct = total > 0 ? (double) withEntities / total * 100 : 0.0;
		double avg = total > 0 ? (double) entityCount / total : 0.0;
		return new CoverageMetrics(total, withEntities, total - withEntities, pct, avg, types, top);
	}

	/**
	 * Samples of false positives, false negatives and assertion disagreements.
	 * Entities are traced back to their case through (start, end, type); an
	 * error whose case cannot be found is left out of the sample.
	 */
	public static ErrorExamples errorExamples(MatchResult result, List<GoldCase> goldCases, List<PredCase> predCases,
			int maxExamples) {
		Map<String, GoldCase> goldById = new HashMap<>();
		Map<List<Object>, String> goldEntityCase = new HashMap<>();
		for (GoldCase c : goldCases) {
			goldById.put(c.getCaseId(), c);
			for (GoldEntity e : c.getGoldEntities()) {
				goldEntityCase.put(key(e), c.getCaseId());
			}
		}
		Map<String, PredCase> predById = new HashMap<>();
		Map<List<Object>, String> predEntityCase = new HashMap<>();
		for (PredCase c : predCases) {
			predById.put(c.getCaseId(), c);
			for (PredEntity e : c.getEntities()) {
				predEntityCase.put(key(e), c.getCaseId());
			}
		}

		List<Map<String, Object>> fps = new ArrayList<>();
		List<PredEntity> unmatchedPred = result.getUnmatchedPred();
		for (PredEntity p : unmatchedPred.subList(0, Math.min(maxExamples, unmatchedPred.size()))) {
			String caseId = predEntityCase.get(key(p));
			if (caseId == null || caseId.isEmpty()) {
				continue;
			}
			PredCase c = predById.get(caseId);
			String text = c == null ? "" : c.getTextForEvaluation();
			Map<String, Object> row = new LinkedHashMap<>();
			row.put("case_id", caseId);
			row.put("text", p.getSpan());
			row.put("type", p.getType());
			row.put("start", p.getStart());
			row.put("end", p.getEnd());
			row.put("score", p.getScore());
			row.put("evidence", isEmpty(p.getEvidence()) ? context(text, p.getStart(), p.getEnd()) : p.getEvidence());
			fps.add(row);
		}

		List<Map<String, Object>> fns = new ArrayList<>();
		List<GoldEntity> unmatchedGold = result.getUnmatchedGold();
		for (GoldEntity g : unmatchedGold.subList(0, Math.min(maxExamples, unmatchedGold.size()))) {
			String caseId = goldEntityCase.get(key(g));
			if (caseId == null || caseId.isEmpty()) {
				continue;
			}
			GoldCase c = goldById.get(caseId);
			String text = c == null ? "" : c.getRawText();
			Map<String, Object> row = new LinkedHashMap<>();
			row.put("case_id", caseId);
			row.put("text", g.getText());
			row.put("type", g.getType());
			row.put("start", g.getStart());
			row.put("end", g.getEnd());
			row.put("context", context(text, g.getStart(), g.getEnd()));
			fns.add(row);
		}

		List<Map<String, Object>> mismatches = new ArrayList<>();
		for (EntityMatch m : result.getMatches()) {
			if (mismatches.size() >= maxExamples) {
				break;
			}
			String gold = m.getGold().getAssertion() == null ? PRESENT : m.getGold().getAssertion();
			String pred = m.getPred().getAssertion() == null ? PRESENT : m.getPred().getAssertion();
			if (gold.equals(pred)) {
				continue;
			}
			String caseId = predEntityCase.get(key(m.getPred()));
			if (caseId == null || caseId.isEmpty()) {
				caseId = goldEntityCase.getOrDefault(key(m.getGold()), "unknown");
			}
			Map<String, Object> row = new LinkedHashMap<>();
			row.put("case_id", caseId);
			row.put("text", m.getGold().getText());
			row.put("type", m.getGold().getType());
			row.put("gold_assertion", gold);
			row.put("pred_assertion", pred);
			row.put("evidence", m.getPred().getEvidence() == null ? "" : m.getPred().getEvidence());
			mismatches.add(row);
		}
		return new ErrorExamples(fps, fns, mismatches);
	}

	/**
	 * Text around a span, {@value #CONTEXT_WINDOW} characters each side. Without
	 * usable offsets, the first {@value #CONTEXT_FALLBACK_CHARS} characters.
	 */
	static String context(String text, Integer start, Integer end) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		String fallback = text.substring(0, Math.min(text.length(), CONTEXT_FALLBACK_CHARS));
		if (start == null || end == null) {
			return fallback;
		}
		int from = Math.max(0, start - CONTEXT_WINDOW);
		int to = Math.min(text.length(), end + CONTEXT_WINDOW);
		if (from >= to) {
			return fallback;
		}
		return text.substring(from, to);
	}

	private static String canonicalAssertion(String label) {
		return Assertion.parseOrPresent(label).name();
	}

	private static List<Object> key(EvalEntity e) {
		return Arrays.asList(e.getStart(), e.getEnd(), e.getType());
	}

	private static boolean isEmpty(String s) {
		return s == null || s.isEmpty();
	}
}
