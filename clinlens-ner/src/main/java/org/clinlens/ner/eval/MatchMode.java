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

import java.util.Locale;

/**
 * Which overlap criteria a relaxed match may use, tried in order: IoU first,
 * then minimum coverage, then containment.
 */
public enum MatchMode {
	IOU("iou", false, false),
	IOU_OR_MIN_COV("iou_or_min_cov", true, false),
	IOU_OR_CONTAINMENT("iou_or_containment", false, true),
	IOU_OR_MIN_COV_OR_CONTAINMENT("iou_or_min_cov_or_containment", true, true);

	private final String value;
	private final boolean minCoverage;
	private final boolean containment;

	MatchMode(String value, boolean minCoverage, boolean containment) {
		this.value = value;
		this.minCoverage = minCoverage;
		this.containment = containment;
	}

	/** Lowercase form used in configuration and reports. */
	public String value() {
		return value;
	}

	public boolean allowsMinCoverage() {
		return minCoverage;
	}

	public boolean allowsContainment() {
		return containment;
	}

	/**
	 * Accepts the lowercase value or the constant name, case-insensitively.
	 *
	 * @return the mode, or {@code null} for blank input
	 * @throws IllegalArgumentException for an unknown mode
	 */
	public static MatchMode fromValue(String s) {
		if (s == null || s.isBlank()) {
			return null;
		}
		String k = s.strip().toLowerCase(Locale.ROOT);
		for (MatchMode m : values()) {
			if (m.value.equals(k)) {
				return m;
			}
		}
		throw new IllegalArgumentException("Unknown match mode: " + s);
	}
}
