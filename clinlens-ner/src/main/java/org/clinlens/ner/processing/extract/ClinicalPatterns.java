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

import java.util.List;
import java.util.regex.Pattern;

import org.clinlens.ner.om.EntityType;

import lombok.Value;

/**
 * High-precision regular expressions for vital signs, scores and bedside
 * procedures. Matched on raw sentence text, ahead of the lexicon.
 */
public final class ClinicalPatterns {

	/** One pattern with the type and score of what it finds. */
	@Value
	public static class PatternDef {
		Pattern pattern;
		EntityType type;
		double score;
	}

	private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
			| Pattern.UNICODE_CHARACTER_CLASS;

	/** Default pattern set, in match order. */
	public static final List<PatternDef> DEFAULT = List.of(
			// Glasgow Coma Scale / GCS
			def("\\b(?:GCS|Glasgow|ECG)\\s*(?:=|:)?\\s*(?:[3-9]|1[0-5])\\b", EntityType.TEST, 0.98),
			// Blood pressure (PA 120x70, 120/70, 120 x 70)
			def("\\b(?:PA\\s*)?\\d{2,3}\\s*(?:x|/)\\s*\\d{2,3}\\b", EntityType.TEST, 0.97),
			// Heart rate (FC 86, pulso 112 bpm)
			def("\\b(?:FC|frequ[eê]ncia\\s*card[ií]aca|pulso)\\s*[:=]?\\s*\\d{2,3}\\s*(?:bpm)?\\b", EntityType.TEST,
					0.97),
			// Respiratory rate (FR 16 irpm)
			def("\\b(?:FR|frequ[eê]ncia\\s*respirat[óo]ria)\\s*[:=]?\\s*\\d{1,3}\\s*(?:irpm|rpm|ipm)?\\b",
					EntityType.TEST, 0.97),
			// Oxygen saturation (sat 98%, saturação 97%)
			def("\\b(?:sat|saturação|saturacao|SpO2)\\s*[:=]?\\s*\\d{2,3}\\s*%?\\b", EntityType.TEST, 0.97),
			// FAST
			def("\\bFAST\\b", EntityType.PROCEDURE, 0.95));

	/** Only the FAST rule; the minimal set. */
	public static final List<PatternDef> FAST_ONLY = List.of(DEFAULT.get(DEFAULT.size() - 1));

	private ClinicalPatterns() {
	}

	private static PatternDef def(String regex, EntityType type, double score) {
		return new PatternDef(Pattern.compile(regex, FLAGS), type, score);
	}
}
