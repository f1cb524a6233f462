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

import lombok.Value;

/**
 * Overlap measures between a predicted and a gold span.
 */
@Value
public class SpanMetrics {
	double iou;
	/** Intersection over the shorter span's length. */
	double minCoverage;
	int intersection;
	/** One span lies inside the other and they share at least one character. */
	boolean containment;

	public static SpanMetrics compute(int predStart, int predEnd, int goldStart, int goldEnd) {
		int intersection = Math.max(0, Math.min(predEnd, goldEnd) - Math.max(predStart, goldStart));
		int predLen = predEnd - predStart;
		int goldLen = goldEnd - goldStart;

		int union = predLen + goldLen - intersection;
		double iou = union > 0 ? (double) intersection / union : 0.0;

		int minLen = Math.min(predLen, goldLen);
		double minCov = minLen > 0 ? (double) intersection / minLen : 0.0;

		boolean contained = intersection > 0 && ((predStart >= goldStart && predEnd <= goldEnd)
				|| (goldStart >= predStart && goldEnd <= predEnd));
		return new SpanMetrics(iou, minCov, intersection, contained);
	}

	/** max(IoU, min coverage), the first tie-break key. */
	public double primaryScore() {
		return Math.max(iou, minCoverage);
	}
}
