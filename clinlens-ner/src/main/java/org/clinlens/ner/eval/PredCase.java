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

import java.util.List;

import lombok.Value;

/**
 * One document of the predictions file, canonicalized: {@code caseId} is the
 * case id, or the document id when the case id is absent.
 */
@Value
public class PredCase {
	String caseId;
	String docId;
	String text;
	List<PredEntity> entities;
	String group;

	/** Text the prediction offsets refer to; never {@code null}. */
	public String getTextForEvaluation() {
		return text == null ? "" : text;
	}
}
