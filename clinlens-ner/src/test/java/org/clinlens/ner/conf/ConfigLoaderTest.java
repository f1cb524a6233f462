package org.clinlens.ner.conf;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.clinlens.ner.eval.MatchMode;
import org.clinlens.ner.processing.NerMode;
import org.clinlens.ner.processing.support.SentenceSegmenter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@AfterEach
	void cleanupSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	private Properties minimalRequiredProps() {
		Properties p = new Properties();
		p.setProperty("INPUT_JSON", "data/cases.json");
		p.setProperty("OUTPUT_PATH", "out/predictions");
		p.setProperty("LEXICON_PATH", "lexicons");
		return p;
	}

	private Properties evaluationProps() {
		Properties p = minimalRequiredProps();
		p.setProperty("EVAL_GOLD", "data/gold.jsonl");
		p.setProperty("EVAL_PRED", "out/predictions/predictions.json");
		p.setProperty("EVAL_REPORT", "out/report.json");
		return p;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void loads_from_file_with_defaults() throws Exception {
		Path f = writePropsFile(minimalRequiredProps(), "conf1.properties");

		ConfigLoader loader = new ConfigLoader(f);

		assertEquals(Path.of("data/cases.json"), loader.getInputJson());
		assertEquals(Path.of("out/predictions"), loader.getOutputPath());
		assertEquals(Path.of("lexicons"), loader.getLexiconPath());
		assertEquals(NerMode.BASELINE, loader.getNerMode());
		assertTrue(loader.isFuzzyEnabled());
		assertEquals(ConfigLoader.DEFAULT_MIN_FUZZY_SCORE, loader.getMinFuzzyScore());
		assertEquals(SentenceSegmenter.DEFAULT_MODEL_PATH, loader.getSentenceModel());
		assertTrue(loader.validate().isEmpty());

		// evaluation defaults
		assertFalse(loader.isEvalRelaxed());
		assertTrue(loader.isEvalUseIou());
		assertEquals(ConfigLoader.DEFAULT_OVERLAP_THRESHOLD, loader.getEvalOverlapThreshold());
		assertNull(loader.getEvalMatchMode());
	}

	@Test
	void reads_explicit_values() throws Exception {
		Properties p = evaluationProps();
		p.setProperty("NER_MODE", "canonical");
		p.setProperty("CANONICAL_PATH", "data/canonical");
		p.setProperty("ENABLE_FUZZY", "false");
		p.setProperty("MIN_FUZZY_SCORE", " 85 ");
		p.setProperty("EVAL_RELAXED", "true");
		p.setProperty("EVAL_OVERLAP_THRESHOLD", "0.6");
		p.setProperty("EVAL_MATCH_MODE", "iou_or_containment");
		p.setProperty("EVAL_USE_IOU", "false");
		ConfigLoader loader = new ConfigLoader(writePropsFile(p, "explicit.properties"));

		assertEquals(NerMode.CANONICAL, loader.getNerMode());
		assertEquals(Path.of("data/canonical"), loader.getCanonicalPath());
		assertFalse(loader.isFuzzyEnabled());
		assertEquals(85, loader.getMinFuzzyScore());
		assertTrue(loader.isEvalRelaxed());
		assertEquals(0.6, loader.getEvalOverlapThreshold());
		assertEquals(MatchMode.IOU_OR_CONTAINMENT, loader.getEvalMatchMode());
		assertFalse(loader.isEvalUseIou());
		assertTrue(loader.validate().isEmpty());
		assertTrue(loader.validateEvaluation().isEmpty());
	}

	@Test
	void validate_reports_missing_required() throws Exception {
		ConfigLoader loader = new ConfigLoader(writePropsFile(new Properties(), "conf_missing.properties"));
		List<String> issues = loader.validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: INPUT_JSON")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: OUTPUT_PATH")));
		// baseline mode does not need the canonical tables
		assertFalse(issues.stream().anyMatch(s -> s.contains("CANONICAL_PATH")));
	}

	@Test
	void validate_flags_bad_mode_and_fuzzy_score() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("NER_MODE", "hybrid");
		p.setProperty("MIN_FUZZY_SCORE", "150");
		List<String> issues = new ConfigLoader(writePropsFile(p, "bad.properties")).validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Unknown NER_MODE")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("MIN_FUZZY_SCORE must be within 0..100")));
	}

	@Test
	void canonical_mode_requires_canonical_path() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("NER_MODE", "canonical");
		List<String> issues = new ConfigLoader(writePropsFile(p, "canonical.properties")).validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: CANONICAL_PATH")));
	}

	@Test
	void validate_evaluation_reports_missing_and_invalid() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("EVAL_OVERLAP_THRESHOLD", "1.5");
		p.setProperty("EVAL_MATCH_MODE", "fuzzy");
		List<String> issues = new ConfigLoader(writePropsFile(p, "eval.properties")).validateEvaluation();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: EVAL_GOLD")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: EVAL_PRED")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: EVAL_REPORT")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("EVAL_OVERLAP_THRESHOLD must be within 0..1")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Unknown match mode: fuzzy")));
	}

	@Test
	void invalid_numbers_fall_back_to_defaults() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("MIN_FUZZY_SCORE", "high");
		p.setProperty("EVAL_OVERLAP_THRESHOLD", "half");
		ConfigLoader loader = new ConfigLoader(writePropsFile(p, "nan.properties"));

		assertEquals(ConfigLoader.DEFAULT_MIN_FUZZY_SCORE, loader.getMinFuzzyScore());
		assertEquals(ConfigLoader.DEFAULT_OVERLAP_THRESHOLD, loader.getEvalOverlapThreshold());
	}

	@Test
	void system_property_override_loads_external_file() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("OUTPUT_PATH", "/elsewhere/out");
		Path f = writePropsFile(p, "override.properties");

		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toAbsolutePath().toString());

		ConfigLoader loader = new ConfigLoader();

		assertEquals(Path.of("/elsewhere/out"), loader.getOutputPath());
	}

	@Test
	void parallel_limit_caps_at_cores() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("PARALLEL_DOCUMENT_LIMIT", "9999");
		ConfigLoader loader = new ConfigLoader(writePropsFile(p, "parallel.properties"));

		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		assertEquals(cores, loader.getParallelDocumentLimit());
	}

	@Test
	void required_getters_throw_when_missing() throws Exception {
		ConfigLoader loader = new ConfigLoader(writePropsFile(new Properties(), "missing_required.properties"));

		assertThrows(IllegalStateException.class, loader::getInputJson);
		assertThrows(IllegalStateException.class, loader::getOutputPath);
		assertThrows(IllegalStateException.class, loader::getCanonicalPath);
		assertThrows(IllegalStateException.class, loader::getEvalGold);
		assertThrows(IllegalStateException.class, loader::getEvalPred);
		assertThrows(IllegalStateException.class, loader::getEvalReport);
	}

	@Test
	void unreadable_file_is_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(tmp.resolve("nope.properties")));
	}
}
