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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.clinlens.ner.om.ClinicalDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CaseLoaderTest {

	@TempDir
	Path tmp;

	private Path write(String name, String json) throws IOException {
		Path p = tmp.resolve(name);
		Files.writeString(p, json, StandardCharsets.UTF_8);
		return p;
	}

	@Test
	void loadsRawTextCases() throws Exception {
		Path file = write("cases.json", "[{\"case_id\": 7, \"group\": \"ubs\", \"raw_text\": \"Febre há 3 dias.\"},"
				+ "{\"case_id\": 12, \"raw_text\": \"Nega tosse.\"}]");

		List<ClinicalDocument> docs = CaseLoader.load(file);

		assertEquals(2, docs.size());
		ClinicalDocument first = docs.get(0);
		assertEquals("cases_case_0007", first.getDocId());
		assertEquals(7L, first.getCaseId());
		assertEquals("ubs", first.getGroup());
		assertEquals("Febre há 3 dias.", first.getText());
		assertEquals(file.toString(), first.getSourcePath());

		assertEquals(CaseLoader.DEFAULT_GROUP, docs.get(1).getGroup());
	}

	@Test
	@DisplayName("text is rebuilt from the structured sections when raw_text is absent")
	void reconstructsText() throws Exception {
		Path file = write("sections.json",
				"[{\"case_id\": 1, \"raw_text\": \"\", \"qd\": \"dor abdominal\", \"hpma\": \"iniciou ontem\", \"af\": null}]");

		ClinicalDocument doc = CaseLoader.load(file).get(0);

		assertEquals("QD: dor abdominal HPMA: iniciou ontem", doc.getText());
	}

	@Test
	void missingCaseIdIsRejected() throws Exception {
		Path file = write("bad.json", "[{\"raw_text\": \"febre\"}]");
		assertThrows(IllegalArgumentException.class, () -> CaseLoader.load(file));
	}

	@Test
	void nonIntegerCaseIdIsRejected() throws Exception {
		Path file = write("bad.json", "[{\"case_id\": \"abc\", \"raw_text\": \"febre\"}]");
		assertThrows(IllegalArgumentException.class, () -> CaseLoader.load(file));
	}

	@Test
	void caseWithoutAnyTextIsRejected() throws Exception {
		Path file = write("bad.json", "[{\"case_id\": 3, \"group\": \"x\"}]");
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CaseLoader.load(file));
		assertTrue(e.getMessage().contains("Case 3"));
	}

	@Test
	void rootMustBeAnArray() throws Exception {
		Path file = write("obj.json", "{\"case_id\": 1, \"raw_text\": \"febre\"}");
		assertThrows(IllegalArgumentException.class, () -> CaseLoader.load(file));
	}

	@Test
	void malformedJsonIsAnIoError() throws Exception {
		Path file = write("broken.json", "[{\"case_id\": 1,");
		assertThrows(IOException.class, () -> CaseLoader.load(file));
	}

	@Test
	void docIdFormat() {
		assertEquals("cases_case_0007", CaseLoader.docId("cases", 7));
		assertEquals("x_case_12345", CaseLoader.docId("x", 12345));
	}
}
