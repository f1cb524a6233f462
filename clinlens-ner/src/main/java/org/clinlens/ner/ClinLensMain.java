package org.clinlens.ner;

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
import java.util.List;

import org.clinlens.ner.conf.ConfigLoader;
import org.clinlens.ner.eval.EvaluationDatasets;
import org.clinlens.ner.eval.EvaluationReport;
import org.clinlens.ner.eval.Evaluator;
import org.clinlens.ner.eval.GoldCase;
import org.clinlens.ner.eval.MatchMode;
import org.clinlens.ner.eval.PredCase;
import org.clinlens.ner.processing.ClinicalPipeline;
import org.clinlens.ner.util.Logger;

/**
 * Main entry point for ClinLens.
 * <p>
 * {@code extract} runs entity extraction over the configured case file and
 * writes predictions; {@code evaluate} scores predictions against gold
 * annotations. Everything else comes from the properties file (see
 * {@link ConfigLoader}).
 */
public class ClinLensMain {

	static final String CMD_EXTRACT = "extract";
	static final String CMD_EVALUATE = "evaluate";

	private final ConfigLoader cfg;

	public ClinLensMain() {
		this(new ConfigLoader());
	}

	ClinLensMain(ConfigLoader cfg) {
		this.cfg = cfg;
	}

	/**
	 * Application entry point. The single argument is the command, default
	 * {@code extract}.
	 */
	public static void main(String[] args) {
		String command = args.length > 0 ? args[0] : CMD_EXTRACT;
		int status;
		try {
			status = new ClinLensMain().run(command);
		} catch (IOException e) {
			Logger.error("I/O failure: {}", e, e.getMessage());
			status = 1;
		} catch (IllegalArgumentException | IllegalStateException e) {
			Logger.error("{}", e.getMessage());
			status = 1;
		}
		if (status != 0) {
			System.exit(status);
		}
	}

	/**
	 * @return process exit status
	 */
	int run(String command) throws IOException {
		switch (command) {
		case CMD_EXTRACT:
			return extract();
		case CMD_EVALUATE:
			return evaluate();
		default:
			Logger.error("Unknown command '{}'; expected {} or {}", command, CMD_EXTRACT, CMD_EVALUATE);
			return 2;
		}
	}

	int extract() throws IOException {
		if (!checked(cfg.validate())) {
			return 1;
		}
		Logger.info("Begin extraction (mode={})", cfg.getNerMode());
		Path combined = ClinicalPipeline.fromConfig(cfg).runOnJson(cfg.getInputJson(), cfg.getOutputPath());
		Logger.info("Predictions written to {}", combined);
		return 0;
	}

	int evaluate() throws IOException {
		if (!checked(cfg.validateEvaluation())) {
			return 1;
		}
		Logger.info("Loading gold annotations from {}", cfg.getEvalGold());
		List<GoldCase> gold = EvaluationDatasets.loadGold(cfg.getEvalGold());
		Logger.info("Loaded {} gold cases", gold.size());

		Logger.info("Loading predictions from {}", cfg.getEvalPred());
		List<PredCase> pred = EvaluationDatasets.loadPredictions(cfg.getEvalPred());
		Logger.info("Loaded {} predicted cases", pred.size());

		boolean relaxed = cfg.isEvalRelaxed();
		boolean useIou = cfg.isEvalUseIou();
		MatchMode mode = effectiveMode(cfg.getEvalMatchMode(), relaxed, useIou);
		Logger.info("Running evaluation (relaxed={}, overlap={}, match_mode={})", relaxed,
				cfg.getEvalOverlapThreshold(), mode == null ? null : mode.value());

		EvaluationReport report = new Evaluator(relaxed, cfg.getEvalOverlapThreshold(), useIou, mode).evaluate(gold,
				pred);
		report.write(cfg.getEvalReport());
		report.logSummary();
		return 0;
	}

	/**
	 * Configured mode, or for relaxed runs without one the broadest mode that
	 * {@code useIou} permits.
	 */
	static MatchMode effectiveMode(MatchMode configured, boolean relaxed, boolean useIou) {
		if (configured != null) {
			return configured;
		}
		if (!relaxed) {
			return null;
		}
		return useIou ? MatchMode.IOU_OR_MIN_COV_OR_CONTAINMENT : MatchMode.IOU_OR_MIN_COV;
	}

	private static boolean checked(List<String> issues) {
		for (String issue : issues) {
			Logger.error("Configuration issue: {}", issue);
		}
		return issues.isEmpty();
	}
}
