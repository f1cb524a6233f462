package org.clinlens.ner.processing.extract;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.clinlens.ner.om.EntitySpan;
import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.om.Evidence;
import org.clinlens.ner.om.Sentence;
import org.clinlens.ner.processing.resolve.ScoredSpans;
import org.clinlens.ner.vocab.CanonicalMatch;
import org.clinlens.ner.vocab.CanonicalVocabularyMatcher;

/**
 * Extractor backed by the canonical vocabulary. Matches run once over the
 * whole document; each hit is then attached to its sentence and carries the
 * linked concept as structured evidence.
 */
public class CanonicalNer implements EntityExtractor {

	private final CanonicalVocabularyMatcher matcher;
	private final Set<EntityType> entityTypes;

	public CanonicalNer(CanonicalVocabularyMatcher matcher) {
		this(matcher, null);
	}

	/**
	 * @param entityTypes only emit these types; {@code null} for all
	 */
	public CanonicalNer(CanonicalVocabularyMatcher matcher, Set<EntityType> entityTypes) {
		this.matcher = Objects.requireNonNull(matcher, "matcher");
		this.entityTypes = entityTypes == null ? null : Set.copyOf(entityTypes);
	}

	@Override
	public List<EntitySpan> extract(String text, List<Sentence> sentences) {
		List<EntitySpan> spans = new ArrayList<>();
		if (text == null || text.isEmpty()) {
			return spans;
		}
		for (CanonicalMatch m : matcher.matchText(text, entityTypes)) {
			int sentStart = 0;
			int sentEnd = text.length();
			String sentText = text;
			if (sentences != null) {
				for (Sentence s : sentences) {
					if (s.contains(m.getStart())) {
						sentStart = s.getStart();
						sentEnd = s.getEnd();
						sentText = s.getText();
						break;
					}
				}
			}
			Evidence evidence = Evidence.ofConcept(sentText.strip(), m.getConceptId(), m.getConceptName(),
					m.getVocabulary(), m.getMatchType(), m.getMatchPolicy(), m.getEntryType());
			spans.add(new EntitySpan(m.getText(), m.getStart(), m.getEnd(), m.getEntityType(), m.getConfidence(),
					sentStart, sentEnd, evidence));
		}
		spans.sort(ScoredSpans.byStartThenScoreDesc());
		return spans;
	}
}
