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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

/**
 * Precision, recall and F1 with the counts behind them. Each ratio is 0 when
 * its denominator is 0.
 */
@Value
@JsonPropertyOrder({ "precision", "recall", "f1", "tp", "fp", "fn" })
public class PrfScore {
	double precision;
	double recall;
	double f1;
	int tp;
	int fp;
	int fn;

	public static PrfScore of(int tp, int fp, int fn) {
		double precision = tp + fp > 0 ? (double) tp / (tp + fp) : 0.0;
		double recall = tp + fn > 0 ? (double) tp / (tp + fn) : 0.0;
		double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;
		return new PrfScore(precision, recall, f1, tp, fp, fn);
	}
}
