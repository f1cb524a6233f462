package org.clinlens.ner.lexicon;

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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.util.Logger;
import org.clinlens.ner.util.TermNormalizer;

/**
 * Reads the per-type lexicon files of a directory into an ordered,
 * duplicate-free (term, type) list and builds the {@link LexiconIndex}.
 * <p>
 * Missing files are reported and skipped. When the directory is missing or
 * nothing could be read, a small built-in lexicon is used instead so the
 * pipeline still produces output.
 */
public class LexiconLoader {

	/** Default term files, in load order once sorted by priority. */
	public static final List<LexiconSource> DEFAULT_SOURCES = List.of(
			new LexiconSource("symptoms_core_ptbr.txt", EntityType.SYMPTOM, 1),
			new LexiconSource("symptoms_expanded_ptbr.txt", EntityType.SYMPTOM, 2),
			new LexiconSource("anatomy_ptbr.txt", EntityType.ANATOMY, 1),
			new LexiconSource("procedures_ptbr.txt", EntityType.PROCEDURE, 1),
			new LexiconSource("tests_exams_ptbr.txt", EntityType.TEST, 1),
			new LexiconSource("drugs_ptbr.txt", EntityType.DRUG, 1));

	private static final List<Map.Entry<String, EntityType>> FALLBACK_LEXICON = List.of(
			// sintomas
			pair("vômito", EntityType.SYMPTOM), pair("vômitos", EntityType.SYMPTOM),
			pair("náusea", EntityType.SYMPTOM), pair("dor epigástrica", EntityType.SYMPTOM),
			pair("dor abdominal", EntityType.SYMPTOM), pair("febre", EntityType.SYMPTOM),
			pair("disúria", EntityType.SYMPTOM), pair("cefaleia", EntityType.SYMPTOM),
			// procedimentos
			pair("fast", EntityType.PROCEDURE),
			// exames
			pair("cultura de urina", EntityType.TEST), pair("hemograma", EntityType.TEST),
			pair("rx", EntityType.TEST), pair("raio x", EntityType.TEST), pair("tomografia", EntityType.TEST),
			// medicamentos
			pair("cefadroxila", EntityType.DRUG), pair("dipirona", EntityType.DRUG),
			pair("paracetamol", EntityType.DRUG));

	private final Path lexiconDir;
	private final List<LexiconSource> sources;

	public LexiconLoader(Path lexiconDir) {
		this(lexiconDir, DEFAULT_SOURCES);
	}

	public LexiconLoader(Path lexiconDir, List<LexiconSource> sources) {
		this.lexiconDir = lexiconDir;
		this.sources = sources == null ? DEFAULT_SOURCES : sources;
	}

	/**
	 * Load every source in priority order (stable for equal priorities),
	 * keeping the first occurrence of each term.
	 *
	 * @return ordered (term, type) pairs; the fallback lexicon when nothing was
	 *         read
	 */
	public List<Map.Entry<String, EntityType>> load() {
		if (lexiconDir == null || !Files.isDirectory(lexiconDir)) {
			Logger.warn("Lexicon directory not found: {}. Falling back to the built-in lexicon", lexiconDir);
			return new ArrayList<>(FALLBACK_LEXICON);
		}

		List<LexiconSource> ordered = new ArrayList<>(sources);
		ordered.sort(Comparator.comparingInt(LexiconSource::getPriority));

		List<Map.Entry<String, EntityType>> all = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		Map<EntityType, Integer> perType = new EnumMap<>(EntityType.class);
		int duplicates = 0;

		for (LexiconSource src : ordered) {
			Path file = lexiconDir.resolve(src.getFileName());
			if (!Files.isReadable(file)) {
				Logger.warn("Lexicon file not found: {}", file);
				continue;
			}
			List<String> terms;
			try {
				terms = readTerms(file);
			} catch (IOException e) {
				Logger.warn("Error reading lexicon file {}: {}", file, e.getMessage());
				continue;
			}
			for (String term : terms) {
				if (seen.add(TermNormalizer.dedupKey(term))) {
					all.add(pair(term, src.getEntityType()));
					perType.merge(src.getEntityType(), 1, Integer::sum);
				} else {
					duplicates++;
				}
			}
		}

		if (all.isEmpty()) {
			Logger.warn("No lexicon terms loaded from {}. Falling back to the built-in lexicon", lexiconDir);
			return new ArrayList<>(FALLBACK_LEXICON);
		}
		Logger.info("Loaded {} lexicon entries from {} (duplicates skipped: {})", all.size(), lexiconDir, duplicates);
		perType.forEach((type, n) -> Logger.info("  {}: {}", type, n));
		return all;
	}

	/** Convenience: {@link #load()} followed by index construction. */
	public LexiconIndex loadIndex() {
		return new LexiconIndex(load());
	}

	/** Built-in terms used when no lexicon file is available. */
	public static List<Map.Entry<String, EntityType>> fallbackLexicon() {
		return FALLBACK_LEXICON;
	}

	// ---- Internals ----

	private static List<String> readTerms(Path file) throws IOException {
		List<String> terms = new ArrayList<>();
		try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			String line;
			while ((line = br.readLine()) != null) {
				String term = line.strip();
				if (term.isEmpty() || term.startsWith("#")) {
					continue;
				}
				terms.add(term);
			}
		}
		return terms;
	}

	private static Map.Entry<String, EntityType> pair(String term, EntityType type) {
		return new AbstractMap.SimpleImmutableEntry<>(term, type);
	}
}
