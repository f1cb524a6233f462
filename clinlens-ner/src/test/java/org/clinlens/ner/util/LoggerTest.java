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

import org.junit.jupiter.api.Test;

class LoggerTest {

	@Test
	void placeholdersAreFilledInOrder() {
		assertEquals("a=1 b=x", Logger.format("a={} b={}", 1, "x"));
	}

	@Test
	void surplusArgumentsAreAppendedAndSurplusPlaceholdersKept() {
		assertEquals("v=1 2", Logger.format("v={}", 1, 2));
		assertEquals("v=1 w={}", Logger.format("v={} w={}", 1));
	}

	@Test
	void warningsAreCounted() {
		Logger.resetCounters();
		Logger.warn("first {}", 1);
		Logger.warn("second", new IllegalStateException("boom"));
		assertEquals(2, Logger.warningCount());
		Logger.resetCounters();
	}
}
