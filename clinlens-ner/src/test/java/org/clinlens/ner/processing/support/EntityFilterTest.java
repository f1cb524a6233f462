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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.clinlens.ner.om.EntityOutput;
import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.util.StopwordRemover;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EntityFilterTest {

	private static final String TEXT = "Paciente com febre, tosse e mancha vermelha.";

	private final EntityFilter filter = new EntityFilter();

	private static EntityOutput entity(String text, Integer start, Integer end, String type) {
		String span = start == null || end == null || start < 0 || end > text.length() || start > end ? "?"
				: text.substring(start, end);
		return new EntityOutput(span, start, end, type, 0.9, "PRESENT", null);
	}

	@Test
	@DisplayName("a bare stopword extracted as a symptom is dropped")
	void stopwordSymptom() {
		assertTrue(filter.filter(List.of(entity("com", 0, 3, "SYMPTOM")), "com").isEmpty());
		assertTrue(filter.filter(List.of(entity(TEXT, 0, 8, "SYMPTOM")), TEXT).isEmpty());
	}

	@Test
	@DisplayName("trailing punctuation is trimmed into a new entity")
	void trimPunctuation() {
		EntityOutput original = entity(TEXT, 13, 19, "SYMPTOM");
		List<EntityOutput> kept = filter.filter(List.of(original), TEXT);

		assertEquals(1, kept.size());
		EntityOutput e = kept.get(0);
		assertEquals("febre", e.getSpan());
		assertEquals(13, e.getStart());
		assertEquals(18, e.getEnd());
		assertEquals(0.9, e.getScore());
		// input left untouched
		assertEquals(19, original.getEnd());
	}

	@Test
	void symptomNeedsNucleus() {
		List<EntityOutput> kept = filter.filter(
				List.of(entity(TEXT, 28, 43, "SYMPTOM"), entity(TEXT, 9, 18, "SYMPTOM")), TEXT);
		assertEquals(1, kept.size());
		assertEquals("com febre", kept.get(0).getSpan());
	}

	@Test
	@DisplayName("stopword and nucleus rules only apply to configured types")
	void otherTypesPass() {
		List<EntityOutput> kept = filter.filter(List.of(entity(TEXT, 0, 8, "TEST")), TEXT);
		assertEquals(1, kept.size());
		assertEquals("Paciente", kept.get(0).getSpan());
	}

	@Test
	void invalidOffsetsAreDropped() {
		List<EntityOutput> in = new ArrayList<>();
		in.add(entity(TEXT, 40, 60, "SYMPTOM"));
		in.add(entity(TEXT, null, 5, "SYMPTOM"));
		in.add(entity(TEXT, 5, 5, "SYMPTOM"));
		in.add(entity(TEXT, -1, 5, "SYMPTOM"));
		assertTrue(filter.filter(in, TEXT).isEmpty());
	}

	@Test
	void spansWithoutLettersAreDropped() {
		String text = "valor 2024";
		assertTrue(filter.filter(List.of(entity(text, 6, 10, "TEST")), text).isEmpty());
	}

	@Test
	@DisplayName("an empty type set applies the token rules to every type")
	void customConfig() {
		FilterConfig config = new FilterConfig(2, EnumSet.noneOf(EntityType.class),
				new StopwordRemover(List.of("com")), Set.of("febre"), false);
		EntityFilter custom = new EntityFilter(config);

		assertTrue(custom.filter(List.of(entity(TEXT, 9, 12, "TEST")), TEXT).isEmpty());
		List<EntityOutput> kept = custom.filter(List.of(entity(TEXT, 13, 19, "DRUG")), TEXT);
		assertEquals(1, kept.size());
		assertEquals("febre,", kept.get(0).getSpan());
	}

	@Test
	void nullInputs() {
		assertTrue(filter.filter(null, TEXT).isEmpty());
		assertTrue(filter.filter(List.of(entity(TEXT, 0, 8, "TEST")), null).isEmpty());
	}
}
