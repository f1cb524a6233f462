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

import java.io.FileInputStream;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import org.clinlens.ner.eval.MatchMode;
import org.clinlens.ner.processing.NerMode;
import org.clinlens.ner.processing.support.SentenceSegmenter;
import org.clinlens.ner.util.Logger;

/**
 * Loads ClinLens settings from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/clinlens.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>clinlens.config</code> to a file path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Files are read as UTF-8, so lexicon paths may contain accents.</li>
 * <li>Use {@link #validate()} before extraction and
 * {@link #validateEvaluation()} before evaluation; both list problems instead
 * of throwing.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/clinlens.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "clinlens.config";

	// ---- Property keys -------------------------------------------------------
	static final String K_LEXICON_PATH = "LEXICON_PATH";
	static final String K_CANONICAL_PATH = "CANONICAL_PATH";
	static final String K_INPUT_JSON = "INPUT_JSON";
	static final String K_OUTPUT_PATH = "OUTPUT_PATH";
	static final String K_NER_MODE = "NER_MODE";
	static final String K_ENABLE_FUZZY = "ENABLE_FUZZY";
	static final String K_MIN_FUZZY_SCORE = "MIN_FUZZY_SCORE";
	static final String K_SENTENCE_MODEL = "SENTENCE_MODEL";
	static final String K_PARALLEL_DOCUMENT_LIMIT = "PARALLEL_DOCUMENT_LIMIT";

	// Evaluation
	static final String K_EVAL_GOLD = "EVAL_GOLD";
	static final String K_EVAL_PRED = "EVAL_PRED";
	static final String K_EVAL_REPORT = "EVAL_REPORT";
	static final String K_EVAL_RELAXED = "EVAL_RELAXED";
	static final String K_EVAL_OVERLAP_THRESHOLD = "EVAL_OVERLAP_THRESHOLD";
	static final String K_EVAL_MATCH_MODE = "EVAL_MATCH_MODE";
	static final String K_EVAL_USE_IOU = "EVAL_USE_IOU";

	public static final String DEFAULT_LEXICON_PATH = "lexicons";
	public static final int DEFAULT_MIN_FUZZY_SCORE = 90;
	public static final double DEFAULT_OVERLAP_THRESHOLD = 0.5;

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	// -------------------------- Validation -------------------------------------

	/**
	 * Checks the settings the extraction run needs. Never throws.
	 *
	 * @return list of human-readable issues; empty if everything looks OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();
		requireNonBlank(K_INPUT_JSON, issues);
		requireNonBlank(K_OUTPUT_PATH, issues);

		NerMode mode = null;
		try {
			mode = getNerMode();
		} catch (IllegalArgumentException e) {
			issues.add("Unknown " + K_NER_MODE + ": '" + properties.getProperty(K_NER_MODE)
					+ "'. Use 'baseline' or 'canonical'.");
		}
		if (mode == NerMode.CANONICAL) {
			requireNonBlank(K_CANONICAL_PATH, issues);
		}

		String fuzzy = getOptional(K_MIN_FUZZY_SCORE, null);
		if (fuzzy != null) {
			try {
				int v = Integer.parseInt(fuzzy);
				if (v < 0 || v > 100) {
					issues.add(K_MIN_FUZZY_SCORE + " must be within 0..100, got " + v);
				}
			} catch (NumberFormatException nfe) {
				issues.add(K_MIN_FUZZY_SCORE + " is not an integer: '" + fuzzy + "'");
			}
		}
		return issues;
	}

	/**
	 * Checks the settings the evaluation run needs. Never throws.
	 */
	public List<String> validateEvaluation() {
		List<String> issues = new ArrayList<>();
		requireNonBlank(K_EVAL_GOLD, issues);
		requireNonBlank(K_EVAL_PRED, issues);
		requireNonBlank(K_EVAL_REPORT, issues);

		String threshold = getOptional(K_EVAL_OVERLAP_THRESHOLD, null);
		if (threshold != null) {
			try {
				double t = Double.parseDouble(threshold);
				if (t < 0.0 || t > 1.0) {
					issues.add(K_EVAL_OVERLAP_THRESHOLD + " must be within 0..1, got " + t);
				}
			} catch (NumberFormatException nfe) {
				issues.add(K_EVAL_OVERLAP_THRESHOLD + " is not a number: '" + threshold + "'");
			}
		}
		try {
			getEvalMatchMode();
		} catch (IllegalArgumentException e) {
			issues.add(e.getMessage());
		}
		return issues;
	}

	// -------------------------- Extraction -------------------------------------

	/** Directory holding the per-type lexicon term files. */
	public Path getLexiconPath() {
		return Path.of(getOptional(K_LEXICON_PATH, DEFAULT_LEXICON_PATH));
	}

	/** Directory holding the four canonical vocabulary tables. */
	public Path getCanonicalPath() {
		return Path.of(getRequired(K_CANONICAL_PATH));
	}

	/** JSON array of cases to process. */
	public Path getInputJson() {
		return Path.of(getRequired(K_INPUT_JSON));
	}

	/** Directory for per-document and combined prediction files. */
	public Path getOutputPath() {
		return Path.of(getRequired(K_OUTPUT_PATH));
	}

	/**
	 * @throws IllegalArgumentException for an unknown mode
	 */
	public NerMode getNerMode() {
		return NerMode.parse(getOptional(K_NER_MODE, null));
	}

	public boolean isFuzzyEnabled() {
		return getBoolean(K_ENABLE_FUZZY, true);
	}

	public int getMinFuzzyScore() {
		return getInt(K_MIN_FUZZY_SCORE, DEFAULT_MIN_FUZZY_SCORE);
	}

	/** OpenNLP sentence model; looked up on disk, then on the classpath. */
	public String getSentenceModel() {
		return getOptional(K_SENTENCE_MODEL, SentenceSegmenter.DEFAULT_MODEL_PATH);
	}

	/**
	 * Worker count for document processing. Defaults to ~25% of available cores
	 * if not set; never exceeds the core count.
	 */
	public int getParallelDocumentLimit() {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, (int) Math.floor(cores / 4.0));

		String raw = getOptional(K_PARALLEL_DOCUMENT_LIMIT, null);
		if (raw != null) {
			try {
				int val = Integer.parseInt(raw.trim());
				if (val <= 0)
					return defaultLimit;
				return Math.min(val, cores);
			} catch (NumberFormatException nfe) {
				Logger.warn("Invalid integer for parallel limit: '{}'. Using default {}", raw, defaultLimit);
			}
		}
		return defaultLimit;
	}

	// -------------------------- Evaluation -------------------------------------

	public Path getEvalGold() {
		return Path.of(getRequired(K_EVAL_GOLD));
	}

	public Path getEvalPred() {
		return Path.of(getRequired(K_EVAL_PRED));
	}

	public Path getEvalReport() {
		return Path.of(getRequired(K_EVAL_REPORT));
	}

	public boolean isEvalRelaxed() {
		return getBoolean(K_EVAL_RELAXED, false);
	}

	public double getEvalOverlapThreshold() {
		String raw = getOptional(K_EVAL_OVERLAP_THRESHOLD, null);
		if (raw == null) {
			return DEFAULT_OVERLAP_THRESHOLD;
		}
		try {
			return Double.parseDouble(raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid number for {}: '{}'. Using default {}", K_EVAL_OVERLAP_THRESHOLD, raw,
					DEFAULT_OVERLAP_THRESHOLD);
			return DEFAULT_OVERLAP_THRESHOLD;
		}
	}

	/**
	 * @return the configured mode, or {@code null} when unset
	 * @throws IllegalArgumentException for an unknown mode
	 */
	public MatchMode getEvalMatchMode() {
		return MatchMode.fromValue(getOptional(K_EVAL_MATCH_MODE, null));
	}

	public boolean isEvalUseIou() {
		return getBoolean(K_EVAL_USE_IOU, true);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
				properties.load(r);
			}
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (Reader r = new InputStreamReader(new FileInputStream(file.toFile()), StandardCharsets.UTF_8)) {
			properties.load(r);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null || v.isBlank()) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private int getInt(String key, int defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			return Integer.parseInt(raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private boolean getBoolean(String key, boolean defaultVal) {
		String raw = getOptional(key, null);
		return raw == null ? defaultVal : Boolean.parseBoolean(raw);
	}

	private void requireNonBlank(String key, List<String> issues) {
		String v = properties.getProperty(key);
		if (v == null || v.trim().isEmpty()) {
			issues.add("Missing required property: " + key);
		}
	}
}
