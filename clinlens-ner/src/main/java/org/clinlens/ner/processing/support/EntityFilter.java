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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.clinlens.ner.om.EntityOutput;
import org.clinlens.ner.om.EntityType;

/**
 * Post-extraction clean-up that removes junk spans.
 * <p>
 * Every entity must have in-bounds offsets, some non-blank text of at least
 * {@code minChars} characters and at least one letter. Boundary punctuation
 * is trimmed. For the configured types (SYMPTOM by default) the span must
 * also contain a non-stopword token, and a SYMPTOM must contain a nucleus
 * word such as "dor" or "febre".
 */
public class EntityFilter {

	private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

	private final FilterConfig config;

	public EntityFilter() {
		this(FilterConfig.defaults());
	}

	public EntityFilter(FilterConfig config) {
		this.config = config;
	}

	/**
	 * @param entities candidate entities; not modified
	 * @param text     document text the offsets refer to
	 * @return kept entities in input order, trimmed copies where punctuation was
	 *         removed
	 */
	public List<EntityOutput> filter(List<EntityOutput> entities, String text) {
		List<EntityOutput> kept = new ArrayList<>();
		if (entities == null || text == null) {
			return kept;
		}
		for (EntityOutput ent : entities) {
			EntityOutput checked = check(ent, text);
			if (checked != null) {
				kept.add(checked);
			}
		}
		return kept;
	}

	private EntityOutput check(EntityOutput ent, String text) {
		Integer start = ent.getStart();
		Integer end = ent.getEnd();
		if (start == null || end == null || start < 0 || end > text.length() || end <= start) {
			return null;
		}
		String extracted = text.substring(start, end).strip();
		if (extracted.isEmpty() || extracted.length() < config.getMinChars()) {
			return null;
		}
		if (extracted.chars().noneMatch(Character::isLetter)) {
			return null;
		}

		if (config.isTrimPunct()) {
			int s = start;
			int e = end;
			while (s < e && isPunct(text.charAt(s))) {
				s++;
			}
			while (e > s && isPunct(text.charAt(e - 1))) {
				e--;
			}
			if (s < e && (s != start || e != end)) {
				ent = new EntityOutput(text.substring(s, e), s, e, ent.getType(), ent.getScore(),
						ent.getAssertion(), ent.getEvidence());
				extracted = text.substring(s, e);
			}
		}

		EntityType type = EntityType.parse(ent.getType());
		if (!config.getApplyToTypes().isEmpty() && (type == null || !config.getApplyToTypes().contains(type))) {
			return ent;
		}

		List<String> tokens = new ArrayList<>();
		Matcher m = WORD.matcher(extracted.toLowerCase(Locale.ROOT));
		while (m.find()) {
			tokens.add(m.group());
		}
		if (tokens.isEmpty() || config.getStopwords().allStopwords(tokens)) {
			return null;
		}
		if (type == EntityType.SYMPTOM && !config.hasNucleus(tokens)) {
			return null;
		}
		return ent;
	}

	private static boolean isPunct(char c) {
		return !Character.isLetterOrDigit(c) && !Character.isWhitespace(c);
	}
}
