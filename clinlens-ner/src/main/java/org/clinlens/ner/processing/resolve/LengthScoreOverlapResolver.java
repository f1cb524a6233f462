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
import java.util.Comparator;
import java.util.List;

import org.clinlens.ner.om.ScoredSpan;

/**
 * Overlap resolution that prefers longer spans and falls back to score when
 * lengths are comparable.
 * <p>
 * Spans are visited by start, longest first. Each one is compared with every
 * already-kept span it overlaps <em>significantly</em> (more than half the
 * shorter of the two). Against one such span it wins when:
 * <ul>
 * <li>it is more than 20% longer</li>
 * <li>or it is at most 20% shorter and has a strictly higher score</li>
 * </ul>
 * A candidate that wins against all of its conflicts replaces them; one that
 * loses against any of them is dropped. No two spans in the output overlap by
 * more than half the shorter one; smaller overlaps are kept.
 */
public class LengthScoreOverlapResolver<T extends ScoredSpan> implements OverlapResolver<T> {

	private static final double SIGNIFICANT_OVERLAP = 0.5;
	private static final double LONGER_FACTOR = 1.2;
	private static final double SHORTER_FACTOR = 0.8;

	@Override
	public List<T> resolve(List<T> spans) {
		if (spans == null || spans.isEmpty()) {
			return new ArrayList<>();
		}
		List<T> ordered = new ArrayList<>(spans);
		ordered.sort(Comparator.<T>comparingInt(ScoredSpan::getStart)
				.thenComparing(Comparator.<T>comparingInt(ScoredSpan::length).reversed())
				.thenComparing(Comparator.<T>comparingDouble(ScoredSpan::getScore).reversed()));

		List<T> kept = new ArrayList<>();
		for (T span : ordered) {
			List<T> conflicts = new ArrayList<>();
			boolean beaten = false;
			for (T existing : kept) {
				if (!significantOverlap(span, existing)) {
					continue;
				}
				if (!beats(span, existing)) {
					beaten = true;
					break;
				}
				conflicts.add(existing);
			}
			if (beaten) {
				continue;
			}
			kept.removeAll(conflicts);
			kept.add(span);
		}

		kept.sort(ScoredSpans.byStartThenScoreDesc());
		return kept;
	}

	private static boolean significantOverlap(ScoredSpan a, ScoredSpan b) {
		return a.overlap(b) > SIGNIFICANT_OVERLAP * Math.min(a.length(), b.length());
	}

	private static boolean beats(ScoredSpan candidate, ScoredSpan existing) {
		if (candidate.length() > existing.length() * LONGER_FACTOR) {
			return true;
		}
		return candidate.length() >= existing.length() * SHORTER_FACTOR
				&& candidate.getScore() > existing.getScore();
	}
}
