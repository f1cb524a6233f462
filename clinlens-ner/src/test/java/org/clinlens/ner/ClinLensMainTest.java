package org.clinlens.ner;

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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.clinlens.ner.conf.ConfigLoader;
import org.clinlens.ner.eval.MatchMode;
import org.clinlens.ner.util.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;

class ClinLensMainTest {

	@TempDir
	Path tmp;

	private ClinLensMain app(Properties p) throws IOException {
		Path f = tmp.resolve("app.properties");
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return new ClinLensMain(new ConfigLoader(f));
	}

	@Test
	void effectiveMode() {
		assertEquals(MatchMode.IOU, ClinLensMain.effectiveMode(MatchMode.IOU, true, false));
		assertNull(ClinLensMain.effectiveMode(null, false, true));
		assertEquals(MatchMode.IOU_OR_MIN_COV_OR_CONTAINMENT, ClinLensMain.effectiveMode(null, true, true));
		assertEquals(MatchMode.IOU_OR_MIN_COV, ClinLensMain.effectiveMode(null, true, false));
	}

	@Test
	void unknownCommand() throws Exception {
		assertEquals(2, app(new Properties()).run("train"));
	}

	@Test
	@DisplayName("configuration issues stop a command before any work")
	void invalidConfiguration() throws Exception {
		ClinLensMain app = app(new Properties());
		assertEquals(1, app.run(ClinLensMain.CMD_EXTRACT));
		assertEquals(1, app.run(ClinLensMain.CMD_EVALUATE));
	}

	@Test
	void extractWritesPredictions() throws Exception {
		Path input = tmp.resolve("cases.json");
		Files.writeString(input, "[{\"case_id\": 4, \"raw_text\": \"Refere cefaleia e febre.\"}]",
				StandardCharsets.UTF_8);
		Properties p = new Properties();
		p.setProperty("INPUT_JSON", input.toString());
		p.setProperty("OUTPUT_PATH", tmp.resolve("out").toString());
		p.setProperty("LEXICON_PATH", "src/test/resources/lexicons");
		p.setProperty("SENTENCE_MODEL", tmp.resolve("no-model.bin").toString());
		p.setProperty("PARALLEL_DOCUMENT_LIMIT", "1");

		assertEquals(0, app(p).run(ClinLensMain.CMD_EXTRACT));

		JsonNode doc = Json.mapper().readTree(tmp.resolve("out/cases_case_0004.json").toFile());
		assertEquals(4, doc.get("case_id").asInt());
		assertTrue(doc.get("entities").size() >= 2);
	}

	@Test
	void evaluateWritesReport() throws Exception {
		Path report = tmp.resolve("report/eval.json");
		Properties p = new Properties();
		p.setProperty("EVAL_GOLD", "src/test/resources/eval/gold.jsonl");
		p.setProperty("EVAL_PRED", "src/test/resources/eval/predictions.json");
		p.setProperty("EVAL_REPORT", report.toString());
		p.setProperty("EVAL_RELAXED", "true");
		p.setProperty("EVAL_OVERLAP_THRESHOLD", "0.6");

		assertEquals(0, app(p).run(ClinLensMain.CMD_EVALUATE));

		JsonNode config = Json.mapper().readTree(report.toFile()).get("config");
		assertEquals("iou_or_min_cov_or_containment", config.get("match_mode").asText());
		assertEquals(3, config.get("total_matches_found").asInt());
	}
}
