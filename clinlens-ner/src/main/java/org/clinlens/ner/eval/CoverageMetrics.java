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

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

/**
 * How much of the prediction set carries entities, and which ones.
 */
@Value
@JsonPropertyOrder({ "total_cases", "cases_with_entities", "cases_without_entities", "pct_cases_with_entities",
		"avg_entities_per_case", "entity_type_distribution", "top_entity_texts" })
public class CoverageMetrics {
	int totalCases;
	int casesWithEntities;
	int casesWithoutEntities;
	double pctCasesWithEntities;
	double avgEntitiesPerCase;
	Map<String, Integer> entityTypeDistribution;
	List<TextCount> topEntityTexts;

	@Value
	@JsonPropertyOrder({ "text", "count" })
	public static class TextCount {
		String text;
		int count;
	}
}
