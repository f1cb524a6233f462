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

import java.util.regex.Pattern;

/**
 * Light clean-up applied to note text before segmentation. Accents are kept;
 * only line breaks, spacing and blood-pressure style pairs are touched.
 */
public final class TextPreprocessor {

	private static final Pattern MULTI_NEWLINE = Pattern.compile("\\n{3,}");
	private static final Pattern MULTI_SPACE = Pattern.compile("[ \\t]+");
	// 120x70, 120/70, 120 X 70
	private static final Pattern PRESSURE_PAIR = Pattern.compile("(\\d{2,3})\\s*[xX/]\\s*(\\d{2,3})");
	private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile("\\s+([,;:.])");
	private static final Pattern PUNCT_THEN_TEXT = Pattern.compile("([,;:])(\\S)");

	private TextPreprocessor() {
	}

	public static String normalize(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		String out = text.replace("\r\n", "\n").replace('\r', '\n');
		out = MULTI_NEWLINE.matcher(out).replaceAll("\n\n");
		out = MULTI_SPACE.matcher(out).replaceAll(" ");
		out = PRESSURE_PAIR.matcher(out).replaceAll("$1 x $2");
		out = SPACE_BEFORE_PUNCT.matcher(out).replaceAll("$1");
		out = PUNCT_THEN_TEXT.matcher(out).replaceAll("$1 $2");
		return out.strip();
	}
}
