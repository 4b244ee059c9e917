package com.architecture.flowlayout.dto.layout;

/**
 * Recoverable conditions recorded on a layout. None of them interrupts the computation.
 */
public enum NoteType {
    CYCLE_WARNING,          // a transition was excluded from layering to break a cycle
    LANE_DEFAULT_WARNING,   // a node's lane came from the fallback default
    EMPTY_GRAPH_NOTICE      // the document had no nodes
}
