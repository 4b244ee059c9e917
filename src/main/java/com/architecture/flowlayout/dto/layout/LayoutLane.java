package com.architecture.flowlayout.dto.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Horizontal swimlane band. The synthetic lane has no owner.
 */
@Value
@Builder
public class LayoutLane {

    int index;
    String ownerId;
    String label;
    double x;
    double y;
    double width;
    double height;
}
