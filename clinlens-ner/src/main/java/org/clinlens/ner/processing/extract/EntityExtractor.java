package org.clinlens.ner.processing.extract;

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

import org.clinlens.ner.om.EntitySpan;
import org.clinlens.ner.om.Sentence;

/**
 * Turns a document and its sentences into a resolved entity list.
 * Implementations hold only immutable state and may be shared across
 * threads.
 */
public interface EntityExtractor {

	/**
	 * @param text      document text; all returned offsets index into it
	 * @param sentences ordered sentences of {@code text}
	 * @return non-overlapping spans sorted by (start, -score)
	 */
	List<EntitySpan> extract(String text, List<Sentence> sentences);
}
