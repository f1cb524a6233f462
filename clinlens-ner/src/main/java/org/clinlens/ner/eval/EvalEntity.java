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

/**
 * Common view of gold and predicted entities used by the matcher and the
 * metrics. Offsets are {@code null} when the source had no usable integer.
 */
public interface EvalEntity {

	Integer getStart();

	Integer getEnd();

	String getText();

	/** Normalized type label. */
	String getType();

	/** Upper-cased assertion, or {@code null} when absent. */
	String getAssertion();

	default boolean hasOffsets() {
		return getStart() != null && getEnd() != null;
	}
}
