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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.clinlens.ner.util.Logger;

/**
 * Aligns gold and predicted cases by case id, matches their entities and
 * assembles the {@link EvaluationReport}.
 * <p>
 * Entities without integer offsets never take part in matching; both sides
 * count them in the report configuration. Coverage is computed over every predicted case, aligned or not.
 */
public class Evaluator {

	static final int TEXT_LENGTH_TOLERANCE = 10;
	private static final int MAX_LISTED_IDS = 5;

	private final boolean relaxed;
	private final double overlapThreshold;
	private final boolean useIou;
	private final MatchMode matchMode;
	private final EvaluationMatcher matcher;

	/** Strict evaluation. */
	public Evaluator() {
		this(false, EvaluationMatcher.DEFAULT_OVERLAP_THRESHOLD, true, null);
	}

	public Evaluator(boolean relaxed, double overlapThreshold, boolean useIou, MatchMode matchMode) {
		this.relaxed = relaxed;
		this.overlapThreshold = overlapThreshold;
		this.useIou = useIou;
		this.matchMode = matchMode;
		this.matcher = new EvaluationMatcher(relaxed, overlapThreshold, useIou, matchMode);
	}

	/**
	 * @throws IllegalStateException when no case id appears on both sides
	 */
	public EvaluationReport evaluate(List<GoldCase> goldCases, List<PredCase> predCases) {
		List<GoldCase> alignedGold = new ArrayList<>();
		List<PredCase> alignedPred = new ArrayList<>();
		align(goldCases, predCases, alignedGold, alignedPred);
		if (alignedGold.isEmpty()) {
			throw new IllegalStateException("No cases could be aligned between gold and predictions");
		}

		List<EntityMatch> matches = new ArrayList<>();
		List<GoldEntity> unmatchedGold = new ArrayList<>();
		List<PredEntity> unmatchedPred = new ArrayList<>();
		int goldLoaded = 0;
		int predLoaded = 0;
		int goldMissingOffsets = 0;
		int predMissingOffsets = 0;

		for (int i = 0; i < alignedGold.size(); i++) {
			GoldCase gold = alignedGold.get(i);
			PredCase pred = alignedPred.get(i);

			int goldLen = gold.getRawText().length();
			int predLen = pred.getTextForEvaluation().length();
			if (Math.abs(goldLen - predLen) > TEXT_LENGTH_TOLERANCE) {
				Logger.warn("Text length mismatch for case {}: gold={}, pred={}", gold.getCaseId(), goldLen, predLen);
			}

			goldLoaded += gold.getGoldEntities().size();
			predLoaded += pred.getEntities().size();

			List<GoldEntity> validGold = new ArrayList<>();
			for (GoldEntity e : gold.getGoldEntities()) {
				if (e.hasOffsets()) {
					validGold.add(e);
				} else {
					goldMissingOffsets++;
				}
			}
			List<PredEntity> validPred = new ArrayList<>();
			for (PredEntity e : pred.getEntities()) {
				if (e.hasOffsets()) {
					validPred.add(e);
				} else {
					predMissingOffsets++;
				}
			}

			MatchResult r = matcher.match(validGold, validPred);
			matches.addAll(r.getMatches());
			unmatchedGold.addAll(r.getUnmatchedGold());
			unmatchedPred.addAll(r.getUnmatchedPred());
		}

		if (goldMissingOffsets > 0 || predMissingOffsets > 0) {
			Logger.warn("Excluded entities without offsets: gold={}, pred={}", goldMissingOffsets,
					predMissingOffsets);
		}

		MatchResult all = new MatchResult(matches, unmatchedGold, unmatchedPred);

		int byIou = 0;
		int byMinCov = 0;
		int byContainment = 0;
		for (EntityMatch m : matches) {
			if (m.getReason() == MatchReason.IOU) {
				byIou++;
			} else if (m.getReason() == MatchReason.MIN_COV) {
				byMinCov++;
			} else if (m.getReason() == MatchReason.CONTAINMENT) {
				byContainment++;
			}
		}

		EvaluationReport.ReportConfig config = new EvaluationReport.ReportConfig(relaxed, overlapThreshold, useIou,
				matchMode == null ? null : matchMode.value(), alignedGold.size(), goldLoaded, predLoaded,
				goldMissingOffsets, predMissingOffsets, matches.size(), byIou, byMinCov, byContainment);

		return new EvaluationReport(config,
				new EvaluationReport.NerSection(MetricsCalculator.overall(all), MetricsCalculator.perType(all)),
				MetricsCalculator.assertion(matches), MetricsCalculator.coverage(predCases),
				MetricsCalculator.errorExamples(all, goldCases, predCases, MetricsCalculator.DEFAULT_MAX_EXAMPLES));
	}

	// Pairs are appended in gold order; later duplicates of an id replace earlier ones
	private static void align(List<GoldCase> goldCases, List<PredCase> predCases, List<GoldCase> alignedGold,
			List<PredCase> alignedPred) {
		Map<String, GoldCase> goldById = new LinkedHashMap<>();
		for (GoldCase c : goldCases) {
			goldById.put(c.getCaseId(), c);
		}
		Map<String, PredCase> predById = new LinkedHashMap<>();
		for (PredCase c : predCases) {
			predById.put(c.getCaseId(), c);
		}

		List<String> missingPred = new ArrayList<>();
		for (Map.Entry<String, GoldCase> e : goldById.entrySet()) {
			PredCase pred = predById.get(e.getKey());
			if (pred != null) {
				alignedGold.add(e.getValue());
				alignedPred.add(pred);
			} else {
				missingPred.add(e.getKey());
			}
		}
		List<String> missingGold = new ArrayList<>();
		for (String id : predById.keySet()) {
			if (!goldById.containsKey(id)) {
				missingGold.add(id);
			}
		}

		if (!missingGold.isEmpty()) {
			Logger.warn("{} predicted cases have no gold annotation: {}", missingGold.size(), firstIds(missingGold));
		}
		if (!missingPred.isEmpty()) {
			Logger.warn("{} gold cases have no predictions: {}", missingPred.size(), firstIds(missingPred));
		}
	}

	private static List<String> firstIds(List<String> ids) {
		return ids.subList(0, Math.min(MAX_LISTED_IDS, ids.size()));
	}

	public EvaluationMatcher getMatcher() {
		return matcher;
	}
}
