package com.leadpilot.orchestrator.memory;

import java.util.List;

/**
 * Bounded context handed to one stage invocation.
 *
 * Entries are in priority order: current-run results, then long-term facts,
 * then pattern hints. The sum of {@link ContextEntry#cost()} never exceeds
 * {@code maxChars}; section headers added by {@link #render()} are not counted.
 *
 * @param truncated true when something was cut or dropped to fit the budget
 */
public record ContextBundle(
        String             entityKey,
        String             stageName,
        List<ContextEntry> entries,
        int                maxChars,
        boolean            truncated) {

    public ContextBundle {
        entries = List.copyOf(entries);
    }

    public static ContextBundle empty(String entityKey, String stageName) {
        return new ContextBundle(entityKey, stageName, List.of(), 0, false);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int usedChars() {
        return entries.stream().mapToInt(ContextEntry::cost).sum();
    }

    public List<ContextEntry> entries(ContextEntry.Source source) {
        return entries.stream().filter(e -> e.source() == source).toList();
    }

    /** Prompt-ready text, one section per source. Empty string when there is nothing. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        section(sb, "[CURRENT RUN]", entries(ContextEntry.Source.CURRENT_RUN));
        section(sb, "[KNOWN FACTS]", entries(ContextEntry.Source.LONG_TERM));
        section(sb, "[PATTERNS]", entries(ContextEntry.Source.PATTERN));
        return sb.toString().strip();
    }

    private static void section(StringBuilder sb, String header, List<ContextEntry> lines) {
        if (lines.isEmpty()) {
            return;
        }
        sb.append(header).append('\n');
        lines.forEach(e -> sb.append(e.line()).append('\n'));
        sb.append('\n');
    }
}
