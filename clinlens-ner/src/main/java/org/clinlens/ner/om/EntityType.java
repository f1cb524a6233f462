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
 * Clinical entity categories produced by the extractors.
 */
public enum EntityType {
	SYMPTOM, ANATOMY, PROCEDURE, TEST, DRUG, PROBLEM, ABBREV;

	/**
	 * Parse a type name as written in lexicon configuration or vocabulary files.
	 *
	 * @return the type, or {@code null} when the name is blank or unknown
	 */
	public static EntityType parse(String name) {
		if (name == null || name.isBlank()) {
			return null;
		}
		try {
			return EntityType.valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			return null;
		}
	}
}
