package org.clinlens.ner.om;

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

/**
 * Anything with a half-open character range and a confidence score. Both
 * overlap resolution strategies work on this view.
 */
public interface ScoredSpan {

	int getStart();

	int getEnd();

	double getScore();

	default int length() {
		return getEnd() - getStart();
	}

	/** Number of characters shared with {@code other}; 0 when disjoint. */
	default int overlap(ScoredSpan other) {
		return Math.max(0, Math.min(getEnd(), other.getEnd()) - Math.max(getStart(), other.getStart()));
	}
}
