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

import java.util.Locale;

/**
 * Clinical polarity/certainty of a mention.
 */
public enum Assertion {
	PRESENT, NEGATED, POSSIBLE, HISTORICAL;

	/**
	 * Upper-cases and trims the label; anything missing or unrecognized is
	 * {@link #PRESENT}.
	 */
	public static Assertion parseOrPresent(String label) {
		if (label == null) {
			return PRESENT;
		}
		String s = label.trim().toUpperCase(Locale.ROOT);
		for (Assertion a : values()) {
			if (a.name().equals(s)) {
				return a;
			}
		}
		return PRESENT;
	}
}
