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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.clinlens.ner.om.Sentence;
import org.clinlens.ner.util.Logger;

import opennlp.tools.sentdetect.SentenceDetectorME;
import opennlp.tools.sentdetect.SentenceModel;
import opennlp.tools.util.Span;

/**
 * Splits a document into sentences with offsets into the document.
 * <p>
 * Uses an OpenNLP sentence model when one can be opened (file system first,
 * then classpath). Without a model, text is split after {@code . ! ?}
 * followed by whitespace and at every line break. Either way the returned
 * sentences are trimmed, non-empty, ordered and non-overlapping, and
 * {@code text.substring(s.getStart(), s.getEnd()).equals(s.getText())}.
 */
public class SentenceSegmenter {

	public static final String DEFAULT_MODEL_PATH = "models/pt-sent.bin";

	private final SentenceModel model;
	private final ThreadLocal<SentenceDetectorME> detector;

	public SentenceSegmenter() {
		this(DEFAULT_MODEL_PATH);
	}

	/**
	 * @param modelPath OpenNLP sentence model; {@code null} or unreadable selects
	 *                  the rule-based splitter
	 */
	public SentenceSegmenter(String modelPath) {
		this.model = modelPath == null ? null : loadModel(modelPath);
		this.detector = model == null ? null : ThreadLocal.withInitial(() -> new SentenceDetectorME(model));
		if (model == null) {
			Logger.info("No sentence model at {}; using rule-based sentence splitting", modelPath);
		}
	}

	public boolean hasModel() {
		return model != null;
	}

	public List<Sentence> split(String text) {
		List<Sentence> out = new ArrayList<>();
		if (text == null || text.isBlank()) {
			return out;
		}
		if (model == null) {
			return splitByRules(text);
		}
		try {
			for (Span span : detector.get().sentPosDetect(text)) {
				addTrimmed(text, span.getStart(), span.getEnd(), out);
			}
			return out;
		} catch (RuntimeException e) {
			Logger.warn("Sentence detector failed; falling back to rules: {}", e.toString());
			detector.remove();
			return splitByRules(text);
		}
	}

	static List<Sentence> splitByRules(String text) {
		List<Sentence> out = new ArrayList<>();
		int n = text.length();
		int segStart = 0;
		for (int i = 0; i < n; i++) {
			char c = text.charAt(i);
			if (c == '\n') {
				addTrimmed(text, segStart, i, out);
				segStart = i + 1;
			} else if ((c == '.' || c == '!' || c == '?') && i + 1 < n && Character.isWhitespace(text.charAt(i + 1))) {
				addTrimmed(text, segStart, i + 1, out);
				segStart = i + 1;
			}
		}
		addTrimmed(text, segStart, n, out);
		return out;
	}

	private static void addTrimmed(String text, int start, int end, List<Sentence> out) {
		int s = start;
		int e = end;
		while (s < e && Character.isWhitespace(text.charAt(s))) {
			s++;
		}
		while (e > s && Character.isWhitespace(text.charAt(e - 1))) {
			e--;
		}
		if (s < e) {
			out.add(new Sentence(text.substring(s, e), s, e));
		}
	}

	private static SentenceModel loadModel(String path) {
		try (InputStream in = tryOpen(path)) {
			return in == null ? null : new SentenceModel(in);
		} catch (IOException | RuntimeException e) {
			Logger.warn("Could not load sentence model {}: {}", path, e.toString());
			return null;
		}
	}

	/** Try file system first, then classpath. */
	private static InputStream tryOpen(String path) throws IOException {
		Path p = Paths.get(path);
		if (Files.exists(p)) {
			return new FileInputStream(p.toFile());
		}
		return SentenceSegmenter.class.getClassLoader().getResourceAsStream(path);
	}
}
