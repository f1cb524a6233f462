package org.clinlens.ner.processing;

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
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.clinlens.ner.conf.ConfigLoader;
import org.clinlens.ner.lexicon.LexiconLoader;
import org.clinlens.ner.om.Assertion;
import org.clinlens.ner.om.ClinicalDocument;
import org.clinlens.ner.om.DocumentOutput;
import org.clinlens.ner.om.EntityOutput;
import org.clinlens.ner.om.EntitySpan;
import org.clinlens.ner.om.Sentence;
import org.clinlens.ner.processing.extract.CanonicalNer;
import org.clinlens.ner.processing.extract.EntityExtractor;
import org.clinlens.ner.processing.extract.SpanMatcher;
import org.clinlens.ner.processing.support.AssertionClassifier;
import org.clinlens.ner.processing.support.CaseLoader;
import org.clinlens.ner.processing.support.EntityFilter;
import org.clinlens.ner.processing.support.PredictionWriter;
import org.clinlens.ner.processing.support.SentenceSegmenter;
import org.clinlens.ner.processing.support.TextPreprocessor;
import org.clinlens.ner.util.Logger;
import org.clinlens.ner.vocab.CanonicalVocabularyLoader;
import org.clinlens.ner.vocab.CanonicalVocabularyMatcher;

/**
 * Runs notes through preprocessing, sentence splitting, entity extraction,
 * assertion classification and filtering.
 * <p>
 * The extractor and its indexes are built once and shared; documents are
 * processed independently on a bounded pool and come back in input order.
 */
public class ClinicalPipeline {

	private final SentenceSegmenter segmenter;
	private final EntityExtractor extractor;
	private final EntityFilter filter;
	private final int parallelism;

	public ClinicalPipeline(SentenceSegmenter segmenter, EntityExtractor extractor, EntityFilter filter,
			int parallelism) {
		this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
		this.extractor = Objects.requireNonNull(extractor, "extractor");
		this.filter = Objects.requireNonNull(filter, "filter");
		this.parallelism = Math.max(1, parallelism);
	}

	/**
	 * Wire a pipeline from configuration: lexicon or canonical extractor,
	 * sentence model and worker count.
	 */
	public static ClinicalPipeline fromConfig(ConfigLoader cfg) {
		EntityExtractor extractor;
		if (cfg.getNerMode() == NerMode.CANONICAL) {
			var vocabulary = new CanonicalVocabularyLoader(cfg.getCanonicalPath()).load();
			for (String issue : vocabulary.validate()) {
				Logger.warn(issue);
			}
			extractor = new CanonicalNer(new CanonicalVocabularyMatcher(vocabulary));
		} else {
			var index = new LexiconLoader(cfg.getLexiconPath()).loadIndex();
			extractor = new SpanMatcher(index, cfg.isFuzzyEnabled(), cfg.getMinFuzzyScore());
		}
		Logger.info("NER mode: {}", cfg.getNerMode());
		return new ClinicalPipeline(new SentenceSegmenter(cfg.getSentenceModel()), extractor, new EntityFilter(),
				cfg.getParallelDocumentLimit());
	}

	/**
	 * Process one document. The output text is the preprocessed text that all
	 * offsets refer to.
	 */
	public DocumentOutput process(ClinicalDocument doc) {
		String text = TextPreprocessor.normalize(doc.getText());
		List<Sentence> sentences = segmenter.split(text);
		List<EntitySpan> spans = extractor.extract(text, sentences);

		List<EntityOutput> entities = new ArrayList<>(spans.size());
		for (EntitySpan e : spans) {
			String sentence = text.substring(e.getSentenceStart(), e.getSentenceEnd());
			Assertion assertion = AssertionClassifier.classify(sentence, e.getStart() - e.getSentenceStart(),
					e.getEnd() - e.getSentenceStart(), e.getType());
			entities.add(new EntityOutput(e.getSpan(), e.getStart(), e.getEnd(), e.getType().name(), e.getScore(),
					assertion.name(), e.getEvidence()));
		}

		List<EntityOutput> kept = filter.filter(entities, text);
		int dropped = entities.size() - kept.size();
		if (dropped > 0) {
			Logger.debug("{}: filtered out {} junk entities (kept {}/{})", doc.getDocId(), dropped, kept.size(),
					entities.size());
		}
		return new DocumentOutput(doc.getDocId(), doc.getSourcePath(), text, kept, doc.getCaseId(), doc.getGroup());
	}

	/**
	 * Process a batch in parallel. A document that fails is logged and left out;
	 * the rest of the batch continues.
	 *
	 * @return outputs in input order
	 */
	public List<DocumentOutput> run(List<ClinicalDocument> docs) {
		AtomicInteger done = new AtomicInteger();
		AtomicInteger failed = new AtomicInteger();
		int total = docs.size();
		Logger.info("Processing {} documents with {} workers", total, parallelism);

		ForkJoinPool pool = new ForkJoinPool(parallelism);
		try {
			List<DocumentOutput> out = pool.submit(() -> docs.parallelStream().map(doc -> {
				try {
					DocumentOutput result = process(doc);
					int n = done.incrementAndGet();
					if (n % 50 == 0 || n == total) {
						Logger.info("Processed {}/{} documents", n, total);
					}
					return result;
				} catch (RuntimeException e) {
					failed.incrementAndGet();
					Logger.error("Failed to process document {}", e, doc.getDocId());
					return null;
				}
			}).filter(Objects::nonNull).collect(Collectors.toList())).get();

			if (failed.get() > 0) {
				Logger.warn("{} of {} documents failed", failed.get(), total);
			}
			return out;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while processing documents", e);
		} catch (ExecutionException e) {
			throw new IllegalStateException("Document processing failed", e.getCause());
		} finally {
			pool.shutdown();
		}
	}

	/**
	 * Load cases, process them and write the prediction files.
	 *
	 * @return path of the combined predictions file
	 */
	public Path runOnJson(Path inputJson, Path outputDir) throws IOException {
		List<ClinicalDocument> docs = CaseLoader.load(inputJson);
		List<DocumentOutput> results = run(docs);
		Path combined = PredictionWriter.writeAll(outputDir, results);
		Logger.info("Completed: {} cases processed -> {} ({} warnings)", results.size(), outputDir,
				Logger.warningCount());
		return combined;
	}
}
