package com.architecture.flowlayout.service.layout;

public enum SweepDirection {
    /** Reorder ranks R-2 down to 0 by the positions of successors in the next rank. */
    DOWNSTREAM,
    /** Reorder ranks 1 up to R-1 by the positions of predecessors in the previous rank. */
    UPSTREAM;

    public SweepDirection opposite() {
        return this == DOWNSTREAM ? UPSTREAM : DOWNSTREAM;
    }
}
