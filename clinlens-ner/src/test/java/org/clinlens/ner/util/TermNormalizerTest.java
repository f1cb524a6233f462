package org.clinlens.ner.util;

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

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TermNormalizerTest {

	@Test
	@DisplayName("normalize lowercases, folds accents and strips punctuation but keeps hyphens")
	void normalizeBasics() {
		assertEquals("nausea vomitos", TermNormalizer.normalize("Náusea, VÔMITOS!"));
		assertEquals("raio-x de torax", TermNormalizer.normalize("  Raio-X   de  tórax. "));
		assertEquals("", TermNormalizer.normalize(null));
		assertEquals("", TermNormalizer.normalize("?!"));
	}

	@Test
	@DisplayName("whitespace collapses before punctuation removal")
	void collapseThenStrip() {
		assertEquals("dor  febre", TermNormalizer.normalize("dor , febre"));
		assertEquals(List.of("dor", "febre"), TermNormalizer.tokens("dor  febre"));
	}

	@Test
	void tokensOfBlankIsEmpty() {
		assertTrue(TermNormalizer.tokens("   ").isEmpty());
		assertTrue(TermNormalizer.tokens(null).isEmpty());
	}

	@Test
	void upperCaseDetection() {
		assertTrue(TermNormalizer.isUpperCase("A09"));
		assertTrue(TermNormalizer.isUpperCase("ÁCIDO"));
		assertFalse(TermNormalizer.isUpperCase("09"));
		assertFalse(TermNormalizer.isUpperCase("Febre"));
		assertFalse(TermNormalizer.isUpperCase(null));
	}

	@Test
	void dedupKeyIgnoresCaseAccentsAndOuterSpace() {
		assertEquals(TermNormalizer.dedupKey(" Vômito "), TermNormalizer.dedupKey("vomito"));
	}
}
