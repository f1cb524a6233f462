package org.clinlens.ner.processing.support;

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

import java.util.EnumSet;
import java.util.Set;

import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.util.StopwordRemover;
import org.clinlens.ner.util.TermNormalizer;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Settings for {@link EntityFilter}.
 */
@Data
@AllArgsConstructor
public class FilterConfig {

	public static final int DEFAULT_MIN_CHARS = 4;

	/** Words that make a clinical symptom mention on their own. */
	public static final Set<String> DEFAULT_SYMPTOM_NUCLEUS = Set.of("dor", "cefaleia", "febre", "vomito",
			"vômito", "náusea", "nausea", "dispneia", "tosse", "diarreia", "disúria", "disuria", "prostração",
			"astenia", "tontura", "sangramento", "prurido", "edema", "cansaço", "fadiga", "palpitação",
			"palpitacao", "mal", "estar", "desconforto", "ardor", "queimação", "queimacao", "ardência", "ardencia",
			"formigamento", "parestesia", "anorexia", "perda", "ganho", "peso", "sede", "poliúria", "poliuria",
			"oligúria", "oliguria", "incontinência", "incontinencia", "constipação", "constipacao", "obstipação",
			"obstipacao", "flatulência", "flatulencia", "hemorragia", "hematúria", "hematuria", "melena",
			"hematêmese", "hematemese", "hemoptise", "epistaxe", "síncope", "sincope", "convulsão", "convulsao",
			"tremor", "rigidez", "espasmo", "câimbra", "caimbra", "cramp", "fraqueza", "debilidade", "mialgia",
			"artralgia", "cervicalgia", "lombalgia", "dorsalgia", "cefalgia");

	private int minChars;
	/** Types the stopword and nucleus rules apply to; others only get the span checks. */
	private Set<EntityType> applyToTypes;
	private StopwordRemover stopwords;
	private Set<String> symptomNucleus;
	private boolean trimPunct;

	/** Four characters minimum, SYMPTOM only, classpath stopwords, punctuation trimming on. */
	public static FilterConfig defaults() {
		return new FilterConfig(DEFAULT_MIN_CHARS, EnumSet.of(EntityType.SYMPTOM), StopwordRemover.fromClasspath(),
				DEFAULT_SYMPTOM_NUCLEUS, true);
	}

	/** True when some token, compared case and accent insensitively, is a nucleus word. */
	public boolean hasNucleus(Iterable<String> tokens) {
		for (String t : tokens) {
			String key = TermNormalizer.dedupKey(t);
			for (String n : symptomNucleus) {
				if (TermNormalizer.dedupKey(n).equals(key)) {
					return true;
				}
			}
		}
		return false;
	}
}
