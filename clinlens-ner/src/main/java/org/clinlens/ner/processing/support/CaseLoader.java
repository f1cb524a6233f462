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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.clinlens.ner.om.ClinicalDocument;
import org.clinlens.ner.util.Json;
import org.clinlens.ner.util.Logger;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads a JSON array of clinical cases into {@link ClinicalDocument}s.
 * <p>
 * Each case needs an integer {@code case_id} and some text: {@code raw_text}
 * or, failing that, the structured fields {@code qd}, {@code hpma},
 * {@code isda}, {@code ap} and {@code af}, which are joined as
 * {@code "QD: ... HPMA: ..."}. Any case without either is rejected, and so is
 * the whole file.
 */
public final class CaseLoader {

	public static final String DEFAULT_GROUP = "unknown";

	private static final String[][] STRUCTURED_FIELDS = { { "qd", "QD" }, { "hpma", "HPMA" }, { "isda", "ISDA" },
			{ "ap", "AP" }, { "af", "AF" } };

	private CaseLoader() {
	}

	/**
	 * @throws IOException              on unreadable or malformed JSON
	 * @throws IllegalArgumentException when the root is not an array, or a case
	 *                                  has no usable id or text
	 */
	public static List<ClinicalDocument> load(Path jsonPath) throws IOException {
		JsonNode root = Json.mapper().readTree(jsonPath.toFile());
		if (root == null || !root.isArray()) {
			throw new IllegalArgumentException("Expected a JSON array of cases in " + jsonPath + ", got "
					+ (root == null ? "nothing" : root.getNodeType()));
		}
		String stem = stem(jsonPath);
		List<ClinicalDocument> documents = new ArrayList<>();
		for (JsonNode c : root) {
			JsonNode idNode = c.get("case_id");
			if (idNode == null || idNode.isNull()) {
				throw new IllegalArgumentException("Missing 'case_id' in case of " + jsonPath);
			}
			if (!idNode.isIntegralNumber()) {
				throw new IllegalArgumentException("'case_id' must be an integer, got " + idNode);
			}
			long caseId = idNode.asLong();
			String group = textOrNull(c.get("group"));

			String text = textOrNull(c.get("raw_text"));
			if (text == null) {
				text = reconstructText(c);
				if (text == null) {
					throw new IllegalArgumentException(
							"Case " + caseId + ": no text available (missing raw_text and structured fields)");
				}
			}
			documents.add(new ClinicalDocument(docId(stem, caseId), text, jsonPath.toString(), caseId,
					group == null ? DEFAULT_GROUP : group));
		}
		Logger.info("Loaded {} cases from {}", documents.size(), jsonPath);
		return documents;
	}

	/** {@code stem_case_0007} style id. */
	public static String docId(String stem, long caseId) {
		return String.format("%s_case_%04d", stem, caseId);
	}

	static String reconstructText(JsonNode c) {
		List<String> parts = new ArrayList<>();
		for (String[] field : STRUCTURED_FIELDS) {
			String v = textOrNull(c.get(field[0]));
			if (v != null) {
				parts.add(field[1] + ": " + v);
			}
		}
		return parts.isEmpty() ? null : String.join(" ", parts);
	}

	private static String textOrNull(JsonNode node) {
		if (node == null || node.isNull()) {
			return null;
		}
		String s = node.asText();
		return s.isEmpty() ? null : s;
	}

	private static String stem(Path path) {
		String name = path.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}
}
