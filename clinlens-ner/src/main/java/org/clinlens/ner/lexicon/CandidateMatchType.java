package org.clinlens.ner.lexicon;

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

/**
 * How a lexicon candidate was found in a sentence.
 */
public enum CandidateMatchType {
	/** Multi-token term found as a substring of the normalized sentence. */
	EXACT,
	/** Term found through sentence token membership. */
	TOKEN,
	/** Term shares at least one token with the sentence; needs scoring. */
	FUZZY
}
