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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.clinlens.ner.om.EntityType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CanonicalVocabularyMatcherTest {

	private static CanonicalVocabularyMatcher matcher;

	@BeforeAll
	static void loadVocabulary() {
		matcher = new CanonicalVocabularyMatcher(
				new CanonicalVocabularyLoader(Path.of("src/test/resources/canonical")).load());
	}

	private static void assertBounds(String text, CanonicalMatch m) {
		assertEquals(text.substring(m.getStart(), m.getEnd()), m.getText());
	}

	@Test
	@DisplayName("ICD code and official name are both matched at exact original offsets")
	void codeAndOfficialEntry() {
		String text = "Paciente com diarreia (A09).";
		List<CanonicalMatch> matches = matcher.matchText(text);

		assertEquals(2, matches.size());
		CanonicalMatch diarreia = matches.get(0);
		CanonicalMatch code = matches.get(1);

		assertEquals("diarreia", diarreia.getText());
		assertEquals(13, diarreia.getStart());
		assertEquals(21, diarreia.getEnd());
		assertEquals("official", diarreia.getEntryType());
		assertEquals(0.95, diarreia.getConfidence());

		assertEquals("A09", code.getText());
		assertEquals(23, code.getStart());
		assertEquals(26, code.getEnd());
		assertEquals("code", code.getEntryType());
		assertEquals("A09", code.getConceptId());
		assertEquals("CID10", code.getVocabulary());
		assertEquals(EntityType.PROBLEM, code.getEntityType());
		assertEquals(0.90, code.getConfidence());
		assertEquals("exact", code.getMatchType());

		matches.forEach(m -> assertBounds(text, m));
	}

	@Test
	@DisplayName("stopword abbreviations never match")
	void stopwordEntryIsSkipped() {
		// "COM" is an abbreviation entry but also a stopword
		assertTrue(matcher.matchText("com").isEmpty());
	}

	@Test
	@DisplayName("context-required abbreviations match with reduced confidence; drugs match by active ingredient")
	void contextRequiredAndDrugs() {
		String text = "Suspeita de AVC. Iniciado paracetamol 500 mg e solicitado hemograma completo.";
		List<CanonicalMatch> matches = matcher.matchText(text);

		assertEquals(3, matches.size());
		CanonicalMatch avc = matches.get(0);
		assertEquals("AVC", avc.getText());
		assertEquals("context_required", avc.getMatchPolicy());
		assertEquals(0.50, avc.getConfidence());

		CanonicalMatch drug = matches.get(1);
		assertEquals("paracetamol 500 mg", drug.getText());
		assertEquals(EntityType.DRUG, drug.getEntityType());
		assertEquals("TUSS_DRUG", drug.getVocabulary());
		assertEquals("normalized", drug.getMatchType());
		assertEquals("drug_normalized", drug.getEntryType());
		assertEquals(0.85, drug.getConfidence());

		CanonicalMatch exam = matches.get(2);
		assertEquals("hemograma completo", exam.getText());
		assertEquals(EntityType.TEST, exam.getEntityType());

		matches.forEach(m -> assertBounds(text, m));
	}

	@Test
	@DisplayName("type restriction applies to both passes")
	void typeFilter() {
		String text = "Paciente com diarreia (A09) em uso de dipirona.";
		List<CanonicalMatch> drugs = matcher.matchText(text, Set.of(EntityType.DRUG));
		assertEquals(1, drugs.size());
		assertEquals("dipirona", drugs.get(0).getText());

		List<CanonicalMatch> problems = matcher.matchText(text, Set.of(EntityType.PROBLEM));
		assertEquals(2, problems.size());
		assertTrue(problems.stream().noneMatch(m -> m.getEntityType() == EntityType.DRUG));
	}

	@Test
	@DisplayName("orphan and blocked entries never match")
	void orphanAndBlocked() {
		assertTrue(matcher.matchText("Apresenta dispneia.").isEmpty());
		assertTrue(matcher.matchText("Solicitado hemograma.").isEmpty());
	}

	@Test
	@DisplayName("the higher confidence span wins where an official entry and a drug name start together")
	void overlappingPassesResolveByConfidence() {
		CanonicalVocabulary vocab = new CanonicalVocabulary(
				List.of(new Concept("D1", "PARACETAMOL 500MG COMPRIMIDO", EntityType.DRUG, "Drug", "TUSS", "active")),
				List.of(new VocabEntry("PARACETAMOL", "D1", EntryType.OFFICIAL, MatchPolicy.SAFE_EXACT)), Set.of(),
				Set.of());
		List<CanonicalMatch> matches = new CanonicalVocabularyMatcher(vocab).matchText("Paracetamol 500 mg agora");
		assertEquals(1, matches.size());
		assertEquals("Paracetamol", matches.get(0).getText());
		assertEquals(0.95, matches.get(0).getConfidence());
	}

	@Test
	@DisplayName("short entries: codes always, one letter never, two letters only as uppercase abbreviations")
	void shortEntryPolicy() {
		VocabEntry code = new VocabEntry("E1", "X", EntryType.CODE, MatchPolicy.SAFE_EXACT);
		VocabEntry one = new VocabEntry("A", "X", EntryType.ABBR, MatchPolicy.SAFE_EXACT);
		VocabEntry abbr = new VocabEntry("DM", "X", EntryType.ABBR, MatchPolicy.SAFE_EXACT);
		VocabEntry official = new VocabEntry("DM", "X", EntryType.OFFICIAL, MatchPolicy.SAFE_EXACT);

		assertFalse(CanonicalVocabularyMatcher.shouldSkip("E1", code, "e1"));
		assertTrue(CanonicalVocabularyMatcher.shouldSkip("A", one, "A"));
		assertFalse(CanonicalVocabularyMatcher.shouldSkip("DM", abbr, "DM"));
		assertTrue(CanonicalVocabularyMatcher.shouldSkip("DM", abbr, "dm"));
		assertTrue(CanonicalVocabularyMatcher.shouldSkip("DM", official, "DM"));
		assertTrue(CanonicalVocabularyMatcher.shouldSkip("SEM", official, "sem"));
	}

	@Test
	void confidenceByPolicyThenType() {
		assertEquals(0.50, CanonicalVocabularyMatcher
				.confidence(new VocabEntry("X", "X", EntryType.OFFICIAL, MatchPolicy.CONTEXT_REQUIRED)));
		assertEquals(0.85,
				CanonicalVocabularyMatcher.confidence(new VocabEntry("X", "X", EntryType.ABBR, MatchPolicy.SAFE_EXACT)));
		assertEquals(0.80, CanonicalVocabularyMatcher
				.confidence(new VocabEntry("X", "X", EntryType.DRUG_NORMALIZED, MatchPolicy.SAFE_EXACT)));
	}

	@Test
	void emptyVocabularyMatchesNothing() {
		CanonicalVocabularyMatcher empty = new CanonicalVocabularyMatcher(CanonicalVocabulary.empty());
		assertTrue(empty.matchText("Paciente com diarreia (A09).").isEmpty());
		assertTrue(empty.matchText(null).isEmpty());
	}
}
