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

import java.util.Comparator;

import org.clinlens.ner.om.ScoredSpan;

/**
 * Shared orderings for span lists.
 */
public final class ScoredSpans {

	private ScoredSpans() {
	}

	/** Start ascending, then score descending. */
	public static <T extends ScoredSpan> Comparator<T> byStartThenScoreDesc() {
		return Comparator.<T>comparingInt(ScoredSpan::getStart)
				.thenComparing(Comparator.<T>comparingDouble(ScoredSpan::getScore).reversed());
	}
}
