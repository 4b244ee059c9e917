package com.architecture.flowlayout.dto.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Vertical column holding all nodes of one execution step.
 */
@Value
@Builder
public class LayoutRank {

    int index;
    double x;
    double width;
}
