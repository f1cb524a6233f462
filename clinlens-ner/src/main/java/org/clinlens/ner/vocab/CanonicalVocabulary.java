package org.clinlens.ner.vocab;

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.clinlens.ner.om.EntityType;
import org.clinlens.ner.util.Logger;

/**
 * Read-only view of a loaded canonical vocabulary with its lookup indexes.
 * <p>
 * Entries are indexed by their uppercase text in load order; blocked entries
 * and blank texts never reach the index. Drug concepts are additionally
 * indexed by their {@link DrugNameNormalizer normalized} active ingredient.
 * Once built the structure is never changed, so matchers on different threads
 * can share it.
 */
public final class CanonicalVocabulary {

	private final Map<String, Concept> concepts;
	private final List<VocabEntry> entries;
	private final Map<String, List<VocabEntry>> entryIndex;
	private final Map<String, List<String>> drugIndex;
	private final Set<String> blockedTerms;
	private final Set<String> ambiguousTerms;
	private final List<VocabEntry> orphans;

	public CanonicalVocabulary(List<Concept> conceptRows, List<VocabEntry> entryRows, Set<String> blockedTerms,
			Set<String> ambiguousTerms) {
		Map<String, Concept> byId = new LinkedHashMap<>();
		for (Concept c : conceptRows) {
			byId.putIfAbsent(c.getConceptId(), c);
		}

		Map<String, List<VocabEntry>> index = new LinkedHashMap<>();
		List<VocabEntry> orphanRows = new ArrayList<>();
		for (VocabEntry e : entryRows) {
			if (!byId.containsKey(e.getConceptId())) {
				orphanRows.add(e);
			}
			if (e.getEntryText() == null || e.getEntryText().isBlank()) {
				continue;
			}
			if (e.getMatchPolicy() == MatchPolicy.BLOCKED) {
				continue;
			}
			index.computeIfAbsent(e.getEntryText().toUpperCase(Locale.ROOT), k -> new ArrayList<>()).add(e);
		}

		Map<String, List<String>> drugs = new LinkedHashMap<>();
		for (Concept c : byId.values()) {
			if (c.getEntityType() != EntityType.DRUG) {
				continue;
			}
			String name = DrugNameNormalizer.normalize(c.getConceptName());
			if (!name.isEmpty()) {
				drugs.computeIfAbsent(name, k -> new ArrayList<>()).add(c.getConceptId());
			}
		}

		this.concepts = Collections.unmodifiableMap(byId);
		this.entries = List.copyOf(entryRows);
		index.replaceAll((k, v) -> List.copyOf(v));
		this.entryIndex = Collections.unmodifiableMap(index);
		drugs.replaceAll((k, v) -> List.copyOf(v));
		this.drugIndex = Collections.unmodifiableMap(drugs);
		this.blockedTerms = Set.copyOf(blockedTerms);
		this.ambiguousTerms = Set.copyOf(ambiguousTerms);
		this.orphans = List.copyOf(orphanRows);

		if (!orphans.isEmpty()) {
			Logger.warn("{} vocabulary entries reference unknown concepts and will not match", orphans.size());
		}
		Logger.debug("Built drug index with {} normalized names", drugIndex.size());
	}

	/** An empty vocabulary; matches nothing. */
	public static CanonicalVocabulary empty() {
		return new CanonicalVocabulary(List.of(), List.of(), Set.of(), Set.of());
	}

	public Concept getConcept(String conceptId) {
		return concepts.get(conceptId);
	}

	public Map<String, Concept> getConcepts() {
		return concepts;
	}

	public List<VocabEntry> getEntries() {
		return entries;
	}

	/** Uppercase entry text to its entry records, in load order. */
	public Map<String, List<VocabEntry>> getEntryIndex() {
		return entryIndex;
	}

	/** Normalized drug name to concept ids. */
	public Map<String, List<String>> getDrugIndex() {
		return drugIndex;
	}

	public boolean isBlocked(String term) {
		return term != null && blockedTerms.contains(term.toUpperCase(Locale.ROOT));
	}

	public boolean isAmbiguous(String term) {
		return term != null && ambiguousTerms.contains(term.toUpperCase(Locale.ROOT));
	}

	public boolean isEmpty() {
		return entryIndex.isEmpty() && drugIndex.isEmpty();
	}

	public VocabularyStats stats() {
		Map<String, Integer> byVocabulary = new TreeMap<>();
		Map<String, Integer> byType = new TreeMap<>();
		for (Concept c : concepts.values()) {
			byVocabulary.merge(String.valueOf(c.getVocabulary()), 1, Integer::sum);
			byType.merge(String.valueOf(c.getEntityType()), 1, Integer::sum);
		}
		return new VocabularyStats(concepts.size(), entries.size(), entryIndex.size(), drugIndex.size(),
				blockedTerms.size(), ambiguousTerms.size(), orphans.size(), byVocabulary, byType);
	}

	/**
	 * Referential integrity check.
	 *
	 * @return one message per entry whose concept does not exist; empty when
	 *         consistent
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();
		for (VocabEntry e : orphans) {
			issues.add("Entry '" + e.getEntryText() + "' references missing concept_id " + e.getConceptId());
		}
		return issues;
	}
}
