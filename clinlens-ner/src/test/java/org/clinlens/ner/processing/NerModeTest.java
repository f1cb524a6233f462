package org.clinlens.ner.processing;

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
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NerModeTest {

	@Test
	void parse() {
		assertEquals(NerMode.BASELINE, NerMode.parse("baseline"));
		assertEquals(NerMode.CANONICAL, NerMode.parse(" Canonical "));
		assertEquals(NerMode.BASELINE, NerMode.parse(null));
		assertEquals(NerMode.BASELINE, NerMode.parse(""));
		assertThrows(IllegalArgumentException.class, () -> NerMode.parse("hybrid"));
	}
}
