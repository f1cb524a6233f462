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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.clinlens.ner.om.EntitySpan;
import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.om.Evidence;
import org.clinlens.ner.om.Sentence;
import org.clinlens.ner.vocab.CanonicalVocabulary;
import org.clinlens.ner.vocab.CanonicalVocabularyMatcher;
import org.clinlens.ner.vocab.Concept;
import org.clinlens.ner.vocab.EntryType;
import org.clinlens.ner.vocab.MatchPolicy;
import org.clinlens.ner.vocab.VocabEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CanonicalNerTest {

	private CanonicalVocabularyMatcher matcher;

	@BeforeEach
	void setUp() {
		CanonicalVocabulary vocab = new CanonicalVocabulary(
				List.of(new Concept("A09", "DIARREIA E GASTROENTERITE", EntityType.PROBLEM, "Condition", "CID10",
						"active"),
						new Concept("D1", "DIPIRONA 500MG", EntityType.DRUG, "Drug", "TUSS", "active")),
				List.of(new VocabEntry("A09", "A09", EntryType.CODE, MatchPolicy.SAFE_EXACT),
						new VocabEntry("DIARREIA", "A09", EntryType.OFFICIAL, MatchPolicy.SAFE_EXACT)),
				Set.of(), Set.of());
		matcher = new CanonicalVocabularyMatcher(vocab);
	}

	@Test
	@DisplayName("matches become spans with concept evidence from their sentence")
	void spansCarryConceptEvidence() {
		String text = "Refere diarreia. CID A09, prescrita dipirona.";
		List<Sentence> sentences = List.of(new Sentence("Refere diarreia.", 0, 16),
				new Sentence("CID A09, prescrita dipirona.", 17, 45));

		List<EntitySpan> spans = new CanonicalNer(matcher).extract(text, sentences);

		assertEquals(3, spans.size());
		EntitySpan diarreia = spans.get(0);
		assertEquals("diarreia", diarreia.getSpan());
		assertEquals(0, diarreia.getSentenceStart());
		assertEquals(0.95, diarreia.getScore());

		EntitySpan code = spans.get(1);
		assertEquals("A09", code.getSpan());
		assertEquals(17, code.getSentenceStart());
		assertEquals(45, code.getSentenceEnd());
		Evidence ev = code.getEvidence();
		assertTrue(ev.isStructured());
		assertEquals("A09", ev.getConceptId());
		assertEquals("CID10", ev.getVocabulary());
		assertEquals("code", ev.getEntryType());
		assertEquals("CID A09, prescrita dipirona.", ev.getSentence());

		EntitySpan drug = spans.get(2);
		assertEquals(EntityType.DRUG, drug.getType());
		assertEquals("TUSS_DRUG", drug.getEvidence().getVocabulary());

		@SuppressWarnings("unchecked")
		Map<String, Object> json = (Map<String, Object>) ev.toJson();
		assertEquals("A09", json.get("concept_id"));
		assertEquals("safe_exact", json.get("match_policy"));
	}

	@Test
	@DisplayName("without a containing sentence the whole document is the context")
	void wholeDocumentFallback() {
		String text = "diarreia";
		List<EntitySpan> spans = new CanonicalNer(matcher).extract(text, List.of());
		assertEquals(1, spans.size());
		assertEquals(0, spans.get(0).getSentenceStart());
		assertEquals(text.length(), spans.get(0).getSentenceEnd());
		assertEquals(text, spans.get(0).getEvidence().getSentence());
	}

	@Test
	void typeRestriction() {
		String text = "diarreia e dipirona";
		List<EntitySpan> spans = new CanonicalNer(matcher, Set.of(EntityType.DRUG)).extract(text, null);
		assertEquals(1, spans.size());
		assertEquals("dipirona", spans.get(0).getSpan());
	}
}
