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

import java.util.Map;

import lombok.Value;

/**
 * Load statistics of a {@link CanonicalVocabulary}.
 */
@Value
public class VocabularyStats {
	int totalConcepts;
	int totalEntries;
	int indexedEntries;
	int drugNames;
	int blockedTerms;
	int ambiguousTerms;
	int orphanEntries;
	Map<String, Integer> byVocabulary;
	Map<String, Integer> byEntityType;
}
