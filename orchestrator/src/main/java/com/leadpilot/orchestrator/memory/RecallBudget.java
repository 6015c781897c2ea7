package com.leadpilot.orchestrator.memory;

/**
 * Upper bound on what {@link MemoryManager#recall} may return.
 *
 * @param maxItems maximum number of facts
 * @param maxChars maximum total {@link RecalledFact#cost()}
 */
public record RecallBudget(int maxItems, int maxChars) {

    public RecallBudget {
        if (maxItems < 0 || maxChars < 0) {
            throw new IllegalArgumentException("Recall budget must not be negative");
        }
    }

    public static RecallBudget items(int maxItems) {
        return new RecallBudget(maxItems, Integer.MAX_VALUE);
    }

    public static RecallBudget unbounded() {
        return new RecallBudget(Integer.MAX_VALUE, Integer.MAX_VALUE);
    }
}
