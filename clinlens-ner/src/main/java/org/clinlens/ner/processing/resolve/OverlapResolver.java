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

import java.util.List;

import org.clinlens.ner.om.ScoredSpan;

/**
 * Reduces a list of possibly overlapping spans to a subset that is safe to
 * report. Implementations never mutate their input.
 *
 * @param <T> span type
 */
public interface OverlapResolver<T extends ScoredSpan> {

	/**
	 * @param spans candidate spans, in any order
	 * @return the kept spans, sorted by start ascending then score descending
	 */
	List<T> resolve(List<T> spans);
}
