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
 * Pipeline prediction. Type and assertion are normalized on construction.
 */
@Value
public class PredEntity implements EvalEntity {
	Integer start;
	Integer end;
	String span;
	String type;
	double score;
	String assertion;
	/** Evidence as text; structured evidence is kept as its JSON form. */
	String evidence;

	public PredEntity(Integer start, Integer end, String span, String type, double score, String assertion,
			String evidence) {
		this.start = start;
		this.end = end;
		this.span = span == null ? "" : span;
		this.type = LabelNormalizer.normalizeType(type);
		this.score = score;
		this.assertion = LabelNormalizer.normalizeAssertion(assertion);
		this.evidence = evidence;
	}

	@Override
	public String getText() {
		return span;
	}
}
