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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.clinlens.ner.util.Json;
import org.clinlens.ner.util.Logger;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

/**
 * Full evaluation outcome, serialized as the report JSON.
 */
@Value
@JsonPropertyOrder({ "config", "ner", "assertion", "coverage", "errors" })
public class EvaluationReport {

	ReportConfig config;
	NerSection ner;
	AssertionMetrics assertion;
	CoverageMetrics coverage;
	ErrorExamples errors;

	/** Run settings and loading counters. */
	@Value
	@JsonPropertyOrder({ "relaxed_matching", "overlap_threshold", "use_iou", "match_mode", "total_cases",
			"total_gold_entities_loaded", "total_pred_entities_loaded", "total_gold_entities_with_missing_offsets",
			"total_pred_entities_with_missing_offsets",
			"total_matches_found", "matched_by_iou", "matched_by_min_cov", "matched_by_containment" })
	public static class ReportConfig {
		boolean relaxedMatching;
		double overlapThreshold;
		boolean useIou;
		/** Mode as requested; {@code null} when none was given. */
		String matchMode;
		int totalCases;
		int totalGoldEntitiesLoaded;
		int totalPredEntitiesLoaded;
		int totalGoldEntitiesWithMissingOffsets;
		int totalPredEntitiesWithMissingOffsets;
		int totalMatchesFound;
		int matchedByIou;
		int matchedByMinCov;
		int matchedByContainment;
	}

	@Value
	@JsonPropertyOrder({ "overall", "per_type" })
	public static class NerSection {
		PrfScore overall;
		Map<String, PrfScore> perType;
	}

	/**
	 * Writes the report as indented JSON, creating parent directories.
	 */
	public void write(Path path) throws IOException {
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Json.mapper().writeValue(path.toFile(), this);
		Logger.info("Report saved to {}", path);
	}

	public void logSummary() {
		PrfScore overall = ner.getOverall();
		Logger.info("Overall F1: {}", String.format("%.3f", overall.getF1()));
		Logger.info("Precision: {}", String.format("%.3f", overall.getPrecision()));
		Logger.info("Recall: {}", String.format("%.3f", overall.getRecall()));
		Logger.info("Assertion accuracy: {}", String.format("%.3f", assertion.getAccuracy()));
	}
}
