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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.clinlens.ner.util.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

class EvidenceTest {

	@Test
	void sentenceEvidenceIsAPlainString() throws Exception {
		Evidence e = Evidence.ofSentence("Nega febre.");
		assertFalse(e.isStructured());
		assertEquals("\"Nega febre.\"", Json.mapper().writeValueAsString(e));
		assertEquals("", Evidence.ofSentence(null).getSentence());
	}

	@Test
	@DisplayName("concept evidence serializes as an ordered object")
	void conceptEvidence() throws Exception {
		Evidence e = Evidence.ofConcept("Paciente com diarreia", "A09", "DIARREIA E GASTROENTERITE", "CID10",
				"official", "exact", "official");
		assertTrue(e.isStructured());

		JsonNode node = Json.mapper().readTree(Json.mapper().writeValueAsString(e));
		assertEquals("A09", node.get("concept_id").asText());
		assertEquals("CID10", node.get("vocabulary").asText());
		assertEquals("Paciente com diarreia", node.get("sentence").asText());
		assertEquals("concept_id", node.fieldNames().next());
		assertEquals("A09 DIARREIA E GASTROENTERITE [CID10]", e.toString());
	}

	@Test
	void spanGeometry() {
		EntitySpan a = new EntitySpan("dor abdominal", 5, 18, EntityType.SYMPTOM, 0.95, 0, 19, null);
		EntitySpan b = new EntitySpan("abdominal", 9, 18, EntityType.ANATOMY, 0.9, 0, 19, null);
		EntitySpan c = new EntitySpan("febre", 20, 25, EntityType.SYMPTOM, 0.9, 20, 26, null);
		assertEquals(13, a.length());
		assertEquals(9, a.overlap(b));
		assertEquals(0, a.overlap(c));
	}

	@Test
	void labelParsing() {
		assertEquals(EntityType.DRUG, EntityType.parse(" drug "));
		assertNull(EntityType.parse("sinonimo"));
		assertEquals(Assertion.NEGATED, Assertion.parseOrPresent("negated"));
		assertEquals(Assertion.PRESENT, Assertion.parseOrPresent("UNCERTAIN"));
		assertEquals(Assertion.PRESENT, Assertion.parseOrPresent(null));
	}
}
