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

import org.junit.jupiter.api.Test;

class DrugNameNormalizerTest {

	@Test
	void stripsStrengthAndForm() {
		assertEquals("paracetamol", DrugNameNormalizer.normalize("PARACETAMOL 500MG COMPRIMIDO"));
		assertEquals("dipirona", DrugNameNormalizer.normalize("DIPIRONA SODICA 500MG/ML SOLUCAO"));
		assertEquals("amoxicilina", DrugNameNormalizer.normalize("Cápsula de AMOXICILINA 500 mg"));
	}

	@Test
	void shortOrEmptyNamesGiveNothing() {
		assertEquals("", DrugNameNormalizer.normalize("AAS 100MG"));
		assertEquals("", DrugNameNormalizer.normalize("500 MG COMPRIMIDO"));
		assertEquals("", DrugNameNormalizer.normalize(null));
	}
}
