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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A candidate or final entity mention in document coordinates.
 * <p>
 * Offsets are half-open and refer to the document text handed to the
 * extractor; {@code span} is always {@code text.substring(start, end)}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntitySpan implements ScoredSpan {

	private String span;
	private int start;
	private int end;
	private EntityType type;
	private double score;
	private int sentenceStart;
	private int sentenceEnd;
	private Evidence evidence;

	/** Copy with new offsets and span text; everything else unchanged. */
	public EntitySpan withOffsets(String text, int newStart, int newEnd) {
		return new EntitySpan(text.substring(newStart, newEnd), newStart, newEnd, type, score, sentenceStart,
				sentenceEnd, evidence);
	}
}
