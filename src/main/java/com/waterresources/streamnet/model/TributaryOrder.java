package com.waterresources.streamnet.model;

/**
 * Convention that fixes how the order of a node's upstream list maps onto the
 * computational order.
 */
public enum TributaryOrder {

    /**
     * Tributaries added first are computed last. ABSOLUTE-upstream follows the
     * last-added branch; COMPUTATIONAL-upstream steps into the first-added one.
     */
    ADDED_FIRST,

    /**
     * Mirror image of {@link #ADDED_FIRST}: ABSOLUTE-upstream follows the
     * first-added branch and the last-added branch is computed last.
     */
    ADDED_LAST;

    /**
     * Index, in an upstream list of the given size, of the branch followed by
     * RELATIVE and ABSOLUTE upstream moves. It is also the branch computed first.
     * Reach numbering does not depend on it: entry 0 always continues the reach.
     */
    public int continuationIndex(int upstreamCount) {
        return this == ADDED_FIRST ? upstreamCount - 1 : 0;
    }

    /**
     * Index of the branch computed immediately before the downstream node itself.
     */
    public int lastComputedIndex(int upstreamCount) {
        return this == ADDED_FIRST ? 0 : upstreamCount - 1;
    }

    /**
     * Index of the sibling branch computed after the branch at {@code index}, or -1
     * when {@code index} is the last computed one.
     */
    public int nextComputedIndex(int index, int upstreamCount) {
        if (index == lastComputedIndex(upstreamCount)) return -1;
        return this == ADDED_FIRST ? index - 1 : index + 1;
    }

    /**
     * Index of the sibling branch computed before the branch at {@code index}, or -1
     * when {@code index} is computed first.
     */
    public int previousComputedIndex(int index, int upstreamCount) {
        if (index == continuationIndex(upstreamCount)) return -1;
        return this == ADDED_FIRST ? index + 1 : index - 1;
    }
}
