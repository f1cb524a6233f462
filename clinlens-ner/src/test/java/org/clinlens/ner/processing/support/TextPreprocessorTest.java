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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextPreprocessorTest {

	@Test
	@DisplayName("blood pressure pairs are rewritten to 'a x b'")
	void pressurePairs() {
		assertEquals("PA 120 x 80", TextPreprocessor.normalize("PA 120/80"));
		assertEquals("PA 130 x 90 mmHg", TextPreprocessor.normalize("PA 130X90 mmHg"));
	}

	@Test
	void punctuationSpacing() {
		assertEquals("febre, tosse", TextPreprocessor.normalize("febre ,tosse"));
		assertEquals("QD: dor", TextPreprocessor.normalize("QD :dor"));
	}

	@Test
	@DisplayName("line endings unified and blank-line runs collapsed")
	void newlines() {
		assertEquals("a\n\nb", TextPreprocessor.normalize("a\r\n\r\n\r\n\r\nb"));
		assertEquals("a\nb", TextPreprocessor.normalize("a\rb"));
	}

	@Test
	void spacesAndTabsCollapse() {
		assertEquals("febre alta", TextPreprocessor.normalize("  febre \t  alta  "));
	}

	@Test
	void nullAndEmpty() {
		assertEquals("", TextPreprocessor.normalize(null));
		assertEquals("", TextPreprocessor.normalize(""));
	}
}
