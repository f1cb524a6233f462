package org.clinlens.ner.eval;

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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.clinlens.ner.util.Json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads gold annotations and pipeline predictions into the evaluation model.
 * <p>
 * All field aliases are resolved here: prediction text may be {@code text},
 * {@code raw_text} or {@code normalized_text}, a prediction case id may be
 * {@code case_id} or {@code doc_id}, and an entity's text may be {@code span}
 * or {@code text}. Offsets that are not JSON integers become {@code null}.
 * Malformed JSON is not recovered from.
 */
public final class EvaluationDatasets {

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private EvaluationDatasets() {
	}

	/**
	 * Gold annotations, one JSON object per non-blank line.
	 *
	 * @throws IOException on unreadable files or malformed lines
	 */
	public static List<GoldCase> loadGold(Path path) throws IOException {
		List<GoldCase> cases = new ArrayList<>();
		try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			String line;
			int lineNo = 0;
			while ((line = reader.readLine()) != null) {
				lineNo++;
				if (line.isBlank()) {
					continue;
				}
				JsonNode node;
				try {
					node = Json.mapper().readTree(line);
				} catch (JsonProcessingException e) {
					throw new IOException("Malformed JSON on line " + lineNo + " of " + path, e);
				}
				cases.add(goldCase(node));
			}
		}
		return cases;
	}

	/**
	 * Predictions: an array of cases, a single case object, or an object whose
	 * values are cases.
	 *
	 * @throws IOException              on unreadable or malformed JSON
	 * @throws IllegalArgumentException when the root is neither array nor object
	 */
	public static List<PredCase> loadPredictions(Path path) throws IOException {
		JsonNode root = Json.mapper().readTree(path.toFile());
		List<PredCase> cases = new ArrayList<>();
		if (root != null && root.isArray()) {
			for (JsonNode c : root) {
				cases.add(predCase(c));
			}
		} else if (root != null && root.isObject()) {
			if (root.has("case_id") || root.has("doc_id")) {
				cases.add(predCase(root));
			} else {
				Iterator<JsonNode> it = root.elements();
				while (it.hasNext()) {
					cases.add(predCase(it.next()));
				}
			}
		} else {
			throw new IllegalArgumentException(
					"Unexpected predictions format in " + path + ": " + (root == null ? "empty" : root.getNodeType()));
		}
		return cases;
	}

	static GoldCase goldCase(JsonNode node) {
		JsonNode id = node.get("case_id");
		if (id == null || id.isNull()) {
			throw new IllegalArgumentException("Gold case without 'case_id': " + abbreviate(node));
		}
		List<GoldEntity> entities = new ArrayList<>();
		JsonNode list = node.get("gold_entities");
		if (list != null && list.isArray()) {
			for (JsonNode e : list) {
				entities.add(new GoldEntity(offset(e.get("start")), offset(e.get("end")), text(e.get("text")),
						text(e.get("type")), text(e.get("assertion")), text(e.get("notes"))));
			}
		}
		Map<String, Object> metadata = Collections.emptyMap();
		JsonNode meta = node.get("metadata");
		if (meta != null && meta.isObject()) {
			metadata = Json.mapper().convertValue(meta, MAP_TYPE);
		}
		String rawText = text(node.get("raw_text"));
		return new GoldCase(id.asText(), text(node.get("group")), rawText == null ? "" : rawText, entities,
				metadata);
	}

	static PredCase predCase(JsonNode node) {
		String text = firstNonEmpty(text(node.get("text")), text(node.get("raw_text")),
				text(node.get("normalized_text")));
		String docId = text(node.get("doc_id"));
		String caseId = firstNonEmpty(text(node.get("case_id")), docId);

		List<PredEntity> entities = new ArrayList<>();
		JsonNode list = node.get("entities");
		if (list != null && list.isArray()) {
			for (JsonNode e : list) {
				JsonNode score = e.get("score");
				entities.add(new PredEntity(offset(e.get("start")), offset(e.get("end")),
						firstNonEmpty(text(e.get("span")), text(e.get("text"))), text(e.get("type")),
						score != null && score.isNumber() ? score.asDouble() : 0.0, text(e.get("assertion")),
						evidence(e.get("evidence"))));
			}
		}
		return new PredCase(caseId == null ? "" : caseId, docId, text == null ? "" : text, entities,
				text(node.get("group")));
	}

	/** Integer offset, or {@code null} for anything else. */
	static Integer offset(JsonNode n) {
		if (n == null || !n.isIntegralNumber() || !n.canConvertToInt()) {
			return null;
		}
		return n.intValue();
	}

	private static String evidence(JsonNode n) {
		if (n == null || n.isNull()) {
			return null;
		}
		// structured evidence is kept as its compact JSON text
		return n.isTextual() ? n.asText() : n.toString();
	}

	private static String text(JsonNode n) {
		if (n == null || n.isNull()) {
			return null;
		}
		return n.asText();
	}

	private static String firstNonEmpty(String... values) {
		for (String v : values) {
			if (v != null && !v.isEmpty()) {
				return v;
			}
		}
		return null;
	}

	private static String abbreviate(JsonNode node) {
		String s = node.toString();
		return s.length() > 80 ? s.substring(0, 80) + "..." : s;
	}
}
