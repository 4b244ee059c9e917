package com.architecture.flowlayout.dto.layout;

import com.architecture.flowlayout.dto.flow.GatewayType;
import lombok.Builder;
import lombok.Value;

/**
 * Final placement of one activity or gateway.
 * x/y is the top-left corner of the node's bounding box.
 */
@Value
@Builder
public class LayoutNode {

    String id;
    String label;
    NodeKind kind;
    GatewayType gatewayType;    // gateways only
    String roleId;              // activities only, as given in the document

    int laneIndex;
    int rankIndex;
    int orderInRank;

    double x;
    double y;
    double width;
    double height;

    public double getCenterX() {
        return x + width / 2;
    }

    public double getCenterY() {
        return y + height / 2;
    }
}
