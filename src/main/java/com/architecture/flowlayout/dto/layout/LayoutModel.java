package com.architecture.flowlayout.dto.layout;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Complete result of one layout run, handed to the diagram serializers.
 * width/height are the node bounds; canvasWidth/canvasHeight also cover lanes and margins.
 */
@Value
@Builder
public class LayoutModel {

    List<LayoutNode> nodes;
    List<LayoutEdge> edges;
    List<LayoutLane> lanes;
    List<LayoutRank> ranks;
    List<LayoutNote> notes;

    double width;
    double height;
    double canvasWidth;
    double canvasHeight;
    double scaleFactor;

    LayoutMetadata metadata;

    public Optional<LayoutNode> findNode(String id) {
        return nodes.stream().filter(node -> node.getId().equals(id)).findFirst();
    }

    public Optional<LayoutEdge> findEdge(String id) {
        return edges.stream().filter(edge -> edge.getId().equals(id)).findFirst();
    }
}
