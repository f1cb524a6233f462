package org.clinlens.ner.processing.resolve;

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

import org.clinlens.ner.om.ScoredSpan;

/**
 * Single left-to-right sweep: spans are ordered by start then confidence
 * and a span is kept only if it starts at or after the end of the last kept
 * span. The result never contains two overlapping spans.
 */
public class ConfidenceSweepOverlapResolver<T extends ScoredSpan> implements OverlapResolver<T> {

	@Override
	public List<T> resolve(List<T> spans) {
		List<T> kept = new ArrayList<>();
		if (spans == null || spans.isEmpty()) {
			return kept;
		}
		List<T> ordered = new ArrayList<>(spans);
		ordered.sort(ScoredSpans.byStartThenScoreDesc());

		int lastEnd = -1;
		for (T span : ordered) {
			if (span.getStart() >= lastEnd) {
				kept.add(span);
				lastEnd = span.getEnd();
			}
		}
		return kept;
	}
}
