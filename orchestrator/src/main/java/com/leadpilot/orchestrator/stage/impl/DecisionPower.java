package com.leadpilot.orchestrator.stage.impl;

import java.util.Locale;

/**
 * Buying-decision weight of a job title on a 1-10 scale.
 */
final class DecisionPower {

    /** Minimum score for a person to be targeted. */
    static final int ACCEPT_THRESHOLD = 6;

    private DecisionPower() {}

    static int score(String title) {
        if (title == null || title.isBlank()) {
            return 1;
        }
        String t = " " + title.toLowerCase(Locale.ROOT).replaceAll("[^a-z ]", " ") + " ";
        if (t.contains("chief") || t.contains("founder") || t.contains(" owner ")
                || t.contains(" president ") && !t.contains("vice")
                || t.matches(".* c[a-z]o .*")) {
            return 10;
        }
        if (t.contains(" evp ") || t.contains(" svp ") || t.contains("executive vice")
                || t.contains("senior vice")) {
            return 9;
        }
        if (t.contains(" vp ") || t.contains("vice president")) {
            return 8;
        }
        if (t.contains(" head ") || t.contains("director") || t.contains("general counsel")) {
            return 7;
        }
        if (t.contains("manager") || t.contains(" lead ")) {
            return 5;
        }
        return 3;
    }

    static boolean accepted(int score) {
        return score >= ACCEPT_THRESHOLD;
    }
}
