package org.clinlens.ner.vocab;

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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.util.Logger;

/**
 * Reads the four canonical vocabulary tables from one directory:
 * {@code concepts.csv}, {@code entries.csv}, {@code blocked_terms.csv} and
 * {@code ambiguity.csv}.
 * <p>
 * Loading is best effort. A missing table is logged and treated as empty, a
 * bad row is logged and skipped.
 */
public class CanonicalVocabularyLoader {

	public static final String CONCEPTS_FILE = "concepts.csv";
	public static final String ENTRIES_FILE = "entries.csv";
	public static final String BLOCKED_FILE = "blocked_terms.csv";
	public static final String AMBIGUITY_FILE = "ambiguity.csv";

	private static final CSVFormat CSV = CSVFormat.DEFAULT.withHeader().withIgnoreHeaderCase().withTrim();

	private final Path directory;

	public CanonicalVocabularyLoader(Path directory) {
		this.directory = directory;
	}

	public CanonicalVocabulary load() {
		Logger.info("Loading canonical vocabulary from {}", directory);
		if (directory == null || !Files.isDirectory(directory)) {
			Logger.warn("Canonical vocabulary directory not found: {}", directory);
			return CanonicalVocabulary.empty();
		}

		List<Concept> concepts = new ArrayList<>();
		readTable(CONCEPTS_FILE, r -> {
			String id = value(r, "concept_id");
			if (id.isEmpty()) {
				throw new IllegalArgumentException("missing concept_id");
			}
			String rawType = value(r, "entity_type");
			EntityType type = EntityType.parse(rawType);
			if (type == null) {
				throw new IllegalArgumentException("unknown entity_type '" + rawType + "'");
			}
			concepts.add(new Concept(id, value(r, "concept_name"), type, value(r, "domain"),
					value(r, "vocabulary"), value(r, "status")));
		});

		List<VocabEntry> entries = new ArrayList<>();
		readTable(ENTRIES_FILE, r -> {
			String rawType = value(r, "entry_type");
			EntryType entryType = EntryType.parse(rawType);
			if (entryType == null) {
				throw new IllegalArgumentException("unknown entry_type '" + rawType + "'");
			}
			String rawPolicy = value(r, "match_policy");
			MatchPolicy policy = MatchPolicy.parse(rawPolicy);
			if (policy == null) {
				throw new IllegalArgumentException("unknown match_policy '" + rawPolicy + "'");
			}
			entries.add(new VocabEntry(value(r, "entry_text"), value(r, "concept_id"), entryType, policy));
		});

		Set<String> blocked = new LinkedHashSet<>();
		readTable(BLOCKED_FILE, r -> addUpper(blocked, value(r, "term")));

		Set<String> ambiguous = new LinkedHashSet<>();
		readTable(AMBIGUITY_FILE, r -> addUpper(ambiguous, value(r, "entry_text")));

		CanonicalVocabulary vocabulary = new CanonicalVocabulary(concepts, entries, blocked, ambiguous);
		VocabularyStats stats = vocabulary.stats();
		Logger.info("Loaded {} concepts, {} entries ({} indexed), {} blocked terms, {} ambiguous terms",
				stats.getTotalConcepts(), stats.getTotalEntries(), stats.getIndexedEntries(), stats.getBlockedTerms(),
				stats.getAmbiguousTerms());
		return vocabulary;
	}

	private void readTable(String fileName, Consumer<CSVRecord> rowHandler) {
		Path file = directory.resolve(fileName);
		if (!Files.isRegularFile(file)) {
			Logger.warn("Canonical table not found, treating as empty: {}", file);
			return;
		}
		int row = 0;
		int badRows = 0;
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
				CSVParser parser = new CSVParser(reader, CSV)) {
			for (CSVRecord record : parser) {
				row++;
				try {
					rowHandler.accept(record);
				} catch (RuntimeException e) {
					badRows++;
					Logger.warn("{} row {} skipped: {}", fileName, row, e.getMessage());
				}
			}
		} catch (IOException | RuntimeException e) {
			Logger.error("Error reading canonical table {}", e, file);
		}
		Logger.debug("{}: {} rows read, {} skipped", fileName, row, badRows);
	}

	private static void addUpper(Set<String> target, String term) {
		if (!term.isEmpty()) {
			target.add(term.toUpperCase(Locale.ROOT));
		}
	}

	private static String value(CSVRecord record, String column) {
		if (!record.isMapped(column) || !record.isSet(column)) {
			return "";
		}
		String v = record.get(column);
		return v == null ? "" : v.strip();
	}
}
