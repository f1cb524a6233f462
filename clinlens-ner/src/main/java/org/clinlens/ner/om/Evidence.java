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

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Why an entity was emitted. Baseline spans carry the sentence text; spans
 * from the canonical vocabulary also carry the concept they were linked to
 * and serialize as a structured record.
 */
@Getter
@EqualsAndHashCode
public final class Evidence {

	private final String sentence;
	private final String conceptId;
	private final String conceptName;
	private final String vocabulary;
	private final String matchType;
	private final String matchPolicy;
	private final String entryType;

	private Evidence(String sentence, String conceptId, String conceptName, String vocabulary, String matchType,
			String matchPolicy, String entryType) {
		this.sentence = sentence == null ? "" : sentence;
		this.conceptId = conceptId;
		this.conceptName = conceptName;
		this.vocabulary = vocabulary;
		this.matchType = matchType;
		this.matchPolicy = matchPolicy;
		this.entryType = entryType;
	}

	/** Free-text evidence: the sentence the span was found in. */
	public static Evidence ofSentence(String sentence) {
		return new Evidence(sentence, null, null, null, null, null, null);
	}

	/** Structured evidence for a vocabulary-linked span. */
	public static Evidence ofConcept(String sentence, String conceptId, String conceptName, String vocabulary,
			String matchType, String matchPolicy, String entryType) {
		return new Evidence(sentence, conceptId, conceptName, vocabulary, matchType, matchPolicy, entryType);
	}

	public boolean isStructured() {
		return conceptId != null;
	}

	/**
	 * JSON form: a plain string for sentence evidence, an object for concept
	 * evidence.
	 */
	@JsonValue
	public Object toJson() {
		if (!isStructured()) {
			return sentence;
		}
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("concept_id", conceptId);
		m.put("concept_name", conceptName);
		m.put("vocabulary", vocabulary);
		m.put("match_type", matchType);
		m.put("match_policy", matchPolicy);
		m.put("entry_type", entryType);
		m.put("sentence", sentence);
		return m;
	}

	@Override
	public String toString() {
		return isStructured() ? conceptId + " " + conceptName + " [" + vocabulary + "]" : sentence;
	}
}
