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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.clinlens.ner.om.DocumentOutput;
import org.clinlens.ner.util.Json;
import org.clinlens.ner.util.Logger;

/**
 * Writes pipeline output: one {@code {doc_id}.json} per document and a
 * combined {@value #COMBINED_FILE} array that the evaluator reads directly.
 */
public final class PredictionWriter {

	public static final String COMBINED_FILE = "predictions.json";

	private PredictionWriter() {
	}

	public static Path writeDocument(Path outDir, DocumentOutput doc) throws IOException {
		Files.createDirectories(outDir);
		Path out = outDir.resolve(doc.getDocId() + ".json");
		Json.mapper().writeValue(out.toFile(), doc);
		return out;
	}

	/**
	 * @return path of the combined file
	 */
	public static Path writeAll(Path outDir, List<DocumentOutput> docs) throws IOException {
		Files.createDirectories(outDir);
		for (DocumentOutput doc : docs) {
			Path p = writeDocument(outDir, doc);
			Logger.debug("{} -> {}", doc.getDocId(), p);
		}
		Path combined = outDir.resolve(COMBINED_FILE);
		Json.mapper().writeValue(combined.toFile(), docs);
		Logger.info("Wrote {} documents to {}", docs.size(), outDir);
		return combined;
	}
}
