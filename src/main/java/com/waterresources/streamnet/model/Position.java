package com.waterresources.streamnet.model;

/**
 * Positioning semantics for network traversal.
 */
public enum Position {
    RELATIVE,       // immediate neighbor
    ABSOLUTE,       // topological extreme (End, or top of the main path)
    REACH,          // first node of the reach, or top of the reach
    COMPUTATIONAL   // canonical linear visitation order
}
