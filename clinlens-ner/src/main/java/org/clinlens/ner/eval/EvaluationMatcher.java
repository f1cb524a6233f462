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
import java.util.List;
import java.util.Objects;

import lombok.Getter;

/**
 * Aligns gold entities with predictions within one document.
 * <p>
 * Gold entities are visited in order and each takes the best prediction still
 * free; the pair is then removed from candidacy. This greedy one-to-one
 * assignment depends on gold order and is not a maximum-weight matching.
 * <ul>
 * <li>strict: equal start, end and type; the first such prediction wins</li>
 * <li>relaxed: equal type plus an overlap criterion allowed by the
 * {@link MatchMode}; among candidates the highest max(IoU, min coverage)
 * wins, then the larger intersection, then the closer start. Ties keep the
 * earlier prediction.</li>
 * </ul>
 */
@Getter
public class EvaluationMatcher {

	public static final double DEFAULT_OVERLAP_THRESHOLD = 0.5;

	private final boolean relaxed;
	private final double overlapThreshold;
	/** Effective mode for relaxed matching; {@code null} when strict. */
	private final MatchMode matchMode;

	/** Strict matcher. */
	public EvaluationMatcher() {
		this(false, DEFAULT_OVERLAP_THRESHOLD, true, null);
	}

	/**
	 * @param relaxed          overlap based matching instead of exact offsets
	 * @param overlapThreshold minimum IoU or min coverage
	 * @param useIou           default mode when {@code matchMode} is null:
	 *                         {@link MatchMode#IOU} if true, otherwise
	 *                         {@link MatchMode#IOU_OR_MIN_COV}
	 * @param matchMode        explicit relaxed mode, may be {@code null}
	 */
	public EvaluationMatcher(boolean relaxed, double overlapThreshold, boolean useIou, MatchMode matchMode) {
		this.relaxed = relaxed;
		this.overlapThreshold = overlapThreshold;
		if (!relaxed) {
			this.matchMode = null;
		} else if (matchMode != null) {
			this.matchMode = matchMode;
		} else {
			this.matchMode = useIou ? MatchMode.IOU : MatchMode.IOU_OR_MIN_COV;
		}
	}

	/** Same start, same end, same normalized type. */
	public static boolean strictMatch(EvalEntity gold, EvalEntity pred) {
		return Objects.equals(gold.getStart(), pred.getStart()) && Objects.equals(gold.getEnd(), pred.getEnd())
				&& Objects.equals(gold.getType(), pred.getType());
	}

	/**
	 * Relaxed comparison of two entities with offsets. IoU is tried first, then
	 * min coverage, then containment, each only when the mode allows it.
	 *
	 * @return why they match, or {@code null} when they do not
	 */
	public static MatchReason relaxedMatch(EvalEntity gold, EvalEntity pred, double threshold, MatchMode mode) {
		if (!Objects.equals(gold.getType(), pred.getType())) {
			return null;
		}
		SpanMetrics m = SpanMetrics.compute(pred.getStart(), pred.getEnd(), gold.getStart(), gold.getEnd());
		MatchMode effective = mode == null ? MatchMode.IOU : mode;

		if (m.getIou() >= threshold) {
			return MatchReason.IOU;
		}
		if (effective.allowsMinCoverage() && m.getMinCoverage() >= threshold) {
			return MatchReason.MIN_COV;
		}
		if (effective.allowsContainment() && m.isContainment()) {
			return MatchReason.CONTAINMENT;
		}
		return null;
	}

	/**
	 * @param gold  gold entities with offsets, in annotation order
	 * @param preds predicted entities with offsets
	 */
	public MatchResult match(List<GoldEntity> gold, List<PredEntity> preds) {
		List<EntityMatch> matches = new ArrayList<>();
		List<GoldEntity> unmatchedGold = new ArrayList<>();
		boolean[] used = new boolean[preds.size()];

		for (GoldEntity g : gold) {
			int bestIdx = -1;
			MatchReason bestReason = null;
			SpanMetrics bestMetrics = null;

			for (int i = 0; i < preds.size(); i++) {
				if (used[i]) {
					continue;
				}
				PredEntity p = preds.get(i);
				if (!relaxed) {
					if (strictMatch(g, p)) {
						bestIdx = i;
						break;
					}
					continue;
				}
				MatchReason reason = relaxedMatch(g, p, overlapThreshold, matchMode);
				if (reason == null) {
					continue;
				}
				SpanMetrics metrics = SpanMetrics.compute(p.getStart(), p.getEnd(), g.getStart(), g.getEnd());
				if (bestIdx < 0 || isBetter(metrics, p, bestMetrics, preds.get(bestIdx), g)) {
					bestIdx = i;
					bestReason = reason;
					bestMetrics = metrics;
				}
			}

			if (bestIdx >= 0) {
				used[bestIdx] = true;
				matches.add(new EntityMatch(g, preds.get(bestIdx), relaxed, bestReason));
			} else {
				unmatchedGold.add(g);
			}
		}

		List<PredEntity> unmatchedPred = new ArrayList<>();
		for (int i = 0; i < preds.size(); i++) {
			if (!used[i]) {
				unmatchedPred.add(preds.get(i));
			}
		}
		return new MatchResult(matches, unmatchedGold, unmatchedPred);
	}

	// Strictly greater on (primary score, intersection, -start distance)
	private static boolean isBetter(SpanMetrics m, PredEntity p, SpanMetrics best, PredEntity bestPred,
			GoldEntity g) {
		int c = Double.compare(m.primaryScore(), best.primaryScore());
		if (c != 0) {
			return c > 0;
		}
		c = Integer.compare(m.getIntersection(), best.getIntersection());
		if (c != 0) {
			return c > 0;
		}
		int distance = Math.abs(p.getStart() - g.getStart());
		int bestDistance = Math.abs(bestPred.getStart() - g.getStart());
		return distance < bestDistance;
	}
}
