package org.clinlens.ner.vocab;

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
 * Per-entry rule deciding whether, and how confidently, an entry may match.
 */
public enum MatchPolicy {
	SAFE_EXACT, CONTEXT_REQUIRED, BLOCKED;

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}

	/** @return the matching policy, or {@code null} when unknown or blank */
	public static MatchPolicy parse(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		for (MatchPolicy p : values()) {
			if (p.label().equalsIgnoreCase(value.strip())) {
				return p;
			}
		}
		return null;
	}
}
