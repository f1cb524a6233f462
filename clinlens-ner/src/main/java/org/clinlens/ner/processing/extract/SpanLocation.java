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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of mapping a normalized match back onto original text.
 * <ul>
 * <li>{@link Kind#EXACT}: a window of the original text was validated by
 * normalizing it and comparing with the pattern</li>
 * <li>{@link Kind#APPROXIMATE}: no window validated; offsets are the
 * normalized position taken as is</li>
 * <li>{@link Kind#NOT_FOUND}: the pattern does not occur in the normalized
 * text; offsets are meaningless</li>
 * </ul>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SpanLocation {

	public enum Kind {
		EXACT, APPROXIMATE, NOT_FOUND
	}

	private static final SpanLocation NOT_FOUND = new SpanLocation(Kind.NOT_FOUND, -1, -1);

	Kind kind;
	int start;
	int end;

	public static SpanLocation exact(int start, int end) {
		return new SpanLocation(Kind.EXACT, start, end);
	}

	public static SpanLocation approximate(int start, int end) {
		return new SpanLocation(Kind.APPROXIMATE, start, end);
	}

	public static SpanLocation notFound() {
		return NOT_FOUND;
	}

	public boolean isFound() {
		return kind != Kind.NOT_FOUND;
	}
}
