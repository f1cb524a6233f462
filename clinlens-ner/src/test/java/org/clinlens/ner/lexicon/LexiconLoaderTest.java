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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.clinlens.ner.om.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LexiconLoaderTest {

	@TempDir
	Path tmp;

	private void write(String name, String... lines) throws IOException {
		Files.write(tmp.resolve(name), List.of(lines), StandardCharsets.UTF_8);
	}

	private static List<String> terms(List<Map.Entry<String, EntityType>> pairs) {
		return pairs.stream().map(Map.Entry::getKey).collect(Collectors.toList());
	}

	@Test
	@DisplayName("files load by priority, comments and blanks skipped, first duplicate wins")
	void priorityOrderAndDedup() throws Exception {
		write("symptoms_core_ptbr.txt", "# core", "febre", "", "Vômito");
		write("symptoms_expanded_ptbr.txt", "vomito", "mal estar");
		write("drugs_ptbr.txt", "dipirona", "FEBRE");

		List<Map.Entry<String, EntityType>> loaded = new LexiconLoader(tmp).load();

		// priority 1 files first (core, drugs), then priority 2 (expanded)
		assertEquals(List.of("febre", "Vômito", "dipirona", "mal estar"), terms(loaded));
		assertEquals(EntityType.SYMPTOM, loaded.get(0).getValue());
		assertEquals(EntityType.DRUG, loaded.get(2).getValue());
	}

	@Test
	@DisplayName("missing directory falls back to the built-in lexicon")
	void missingDirectory() {
		List<Map.Entry<String, EntityType>> loaded = new LexiconLoader(tmp.resolve("nope")).load();
		assertEquals(LexiconLoader.fallbackLexicon(), loaded);
	}

	@Test
	@DisplayName("directory without any readable term falls back to the built-in lexicon")
	void emptyDirectory() throws Exception {
		write("anatomy_ptbr.txt", "# only a comment", "   ");
		assertEquals(LexiconLoader.fallbackLexicon(), new LexiconLoader(tmp).load());
	}

	@Test
	void customSourcesAndIndex() throws Exception {
		write("exames.txt", "hemograma", "cultura de urina");
		LexiconIndex index = new LexiconLoader(tmp, List.of(new LexiconSource("exames.txt", EntityType.TEST, 1)))
				.loadIndex();
		assertEquals(2, index.size());
		assertFalse(index.getMultiTokenEntries().isEmpty());
		assertEquals(EntityType.TEST, index.getEntries().get(1).getEntityType());
	}
}
