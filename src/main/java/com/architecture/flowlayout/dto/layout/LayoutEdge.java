package com.architecture.flowlayout.dto.layout;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Routed transition. Waypoints run from the source boundary to the target boundary.
 */
@Value
@Builder
public class LayoutEdge {

    String id;
    String sourceId;
    String targetId;
    String label;               // condition, falling back to the transition name
    List<LayoutPoint> waypoints;
    boolean feedback;           // excluded from layering to break a cycle
}
