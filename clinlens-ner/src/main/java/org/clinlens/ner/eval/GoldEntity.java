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
 * Human annotation. Type and assertion are normalized on construction.
 */
@Value
public class GoldEntity implements EvalEntity {
	Integer start;
	Integer end;
	String text;
	String type;
	String assertion;
	String notes;

	public GoldEntity(Integer start, Integer end, String text, String type, String assertion, String notes) {
		this.start = start;
		this.end = end;
		this.text = text == null ? "" : text;
		this.type = LabelNormalizer.normalizeType(type);
		this.assertion = LabelNormalizer.normalizeAssertion(assertion);
		this.notes = notes;
	}
}
