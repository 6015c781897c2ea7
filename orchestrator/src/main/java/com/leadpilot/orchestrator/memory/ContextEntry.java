package com.leadpilot.orchestrator.memory;

/**
 * One line of a {@link ContextBundle}.
 */
public record ContextEntry(Source source, String label, String text) {

    public enum Source { CURRENT_RUN, LONG_TERM, PATTERN }

    public String line() {
        return label + ": " + text;
    }

    /** Characters this entry consumes from the context budget. */
    public int cost() {
        return line().length() + 1;
    }
}
