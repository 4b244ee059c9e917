package com.architecture.flowlayout.dto.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Summary information about a computed layout.
 */
@Value
@Builder
public class LayoutMetadata {

    String flowId;
    String title;
    int nodeCount;
    int edgeCount;
    int laneCount;
    int rankCount;
    int feedbackEdgeCount;
}
