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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Portuguese stopword list used to reject spans made only of function words
 * ("com", "de", "paciente"). Words are compared after lowercasing and accent
 * folding, so "à" and "a" are the same stopword.
 */
public class StopwordRemover {

	// Default stopword resource path (classpath), with FS fallback
	public static final String CLASSPATH_STOPWORDS = "stopwords_ptbr.txt";
	private static final String FS_STOPWORDS = "src/main/resources/stopwords_ptbr.txt";

	private final Set<String> stopwords;

	/**
	 * Build a remover over an explicit word list.
	 *
	 * @param words raw words; normalized on the way in
	 */
	public StopwordRemover(Collection<String> words) {
		Set<String> s = new HashSet<>();
		if (words != null) {
			for (String w : words) {
				String k = key(w);
				if (!k.isEmpty()) {
					s.add(k);
				}
			}
		}
		this.stopwords = Collections.unmodifiableSet(s);
	}

	/**
	 * Load stopwords from classpath resource {@value #CLASSPATH_STOPWORDS}; if
	 * missing, fall back to {@code src/main/resources/stopwords_ptbr.txt}. Lines
	 * starting with '#' or blank lines are ignored. A missing list is logged and
	 * yields an empty remover.
	 */
	public static StopwordRemover fromClasspath() {
		Set<String> words = new HashSet<>();

		boolean loaded = false;
		try (InputStream in = StopwordRemover.class.getClassLoader().getResourceAsStream(CLASSPATH_STOPWORDS)) {
			if (in != null) {
				try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
					readStopFileInto(br, words);
					loaded = true;
				}
			}
		} catch (IOException ioe) {
			Logger.warn("Stopwords: classpath read failed: {}", ioe.getMessage());
		}

		// Fallback to filesystem (dev mode)
		if (!loaded) {
			Path fs = Path.of(FS_STOPWORDS);
			if (Files.isReadable(fs)) {
				try (BufferedReader br = Files.newBufferedReader(fs, StandardCharsets.UTF_8)) {
					readStopFileInto(br, words);
					loaded = true;
				} catch (IOException e) {
					Logger.error("Error loading stopwords: {}", e.getMessage());
				}
			}
		}
		if (!loaded) {
			Logger.warn("Stopword list {} not found; stopword-only spans will not be filtered", CLASSPATH_STOPWORDS);
		}
		return new StopwordRemover(words);
	}

	private static void readStopFileInto(BufferedReader reader, Set<String> into) throws IOException {
		String line;
		while ((line = reader.readLine()) != null) {
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#"))
				continue;
			into.add(trimmed);
		}
	}

	/**
	 * Returns {@code true} if the given word is a stopword. Null or blank → false.
	 */
	public boolean isStopword(String word) {
		if (word == null || word.isBlank())
			return false;
		return stopwords.contains(key(word));
	}

	/**
	 * Returns {@code true} when every token is a stopword. An empty collection is
	 * not considered stopword-only.
	 */
	public boolean allStopwords(Collection<String> tokens) {
		if (tokens == null || tokens.isEmpty())
			return false;
		for (String t : tokens) {
			if (!isStopword(t))
				return false;
		}
		return true;
	}

	public int size() {
		return stopwords.size();
	}

	private static String key(String w) {
		return w == null ? "" : TermNormalizer.dedupKey(w);
	}
}
