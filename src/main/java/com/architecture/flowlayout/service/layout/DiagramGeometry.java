package com.architecture.flowlayout.service.layout;

/**
 * Scaled coordinates for nodes, lanes and ranks, indexed by arena index.
 * Every value already includes the global scale factor.
 */
public final class DiagramGeometry {

    private final double[] nodeX;
    private final double[] nodeY;
    private final double[] nodeWidth;
    private final double[] nodeHeight;

    private final double[] laneY;
    private final double[] laneHeight;
    private final double laneX;
    private final double laneWidth;

    private final double[] rankX;
    private final double[] rankWidth;
    private final double[] rankContentWidth;

    private final double scale;
    private final double width;
    private final double height;
    private final double canvasWidth;
    private final double canvasHeight;

    DiagramGeometry(double[] nodeX, double[] nodeY, double[] nodeWidth, double[] nodeHeight,
                    double[] laneY, double[] laneHeight, double laneX, double laneWidth,
                    double[] rankX, double[] rankWidth, double[] rankContentWidth,
                    double scale, double canvasWidth, double canvasHeight) {
        this.nodeX = nodeX;
        this.nodeY = nodeY;
        this.nodeWidth = nodeWidth;
        this.nodeHeight = nodeHeight;
        this.laneY = laneY;
        this.laneHeight = laneHeight;
        this.laneX = laneX;
        this.laneWidth = laneWidth;
        this.rankX = rankX;
        this.rankWidth = rankWidth;
        this.rankContentWidth = rankContentWidth;
        this.scale = scale;
        this.canvasWidth = canvasWidth;
        this.canvasHeight = canvasHeight;

        double maxX = 0;
        double maxY = 0;
        for (int node = 0; node < nodeX.length; node++) {
            maxX = Math.max(maxX, nodeX[node] + nodeWidth[node]);
            maxY = Math.max(maxY, nodeY[node] + nodeHeight[node]);
        }
        this.width = maxX;
        this.height = maxY;
    }

    public int nodeCount() {
        return nodeX.length;
    }

    public double x(int node) {
        return nodeX[node];
    }

    public double y(int node) {
        return nodeY[node];
    }

    public double width(int node) {
        return nodeWidth[node];
    }

    public double height(int node) {
        return nodeHeight[node];
    }

    public double centerX(int node) {
        return nodeX[node] + nodeWidth[node] / 2;
    }

    public double centerY(int node) {
        return nodeY[node] + nodeHeight[node] / 2;
    }

    public int laneCount() {
        return laneY.length;
    }

    public double laneY(int lane) {
        return laneY[lane];
    }

    public double laneHeight(int lane) {
        return laneHeight[lane];
    }

    public double laneX() {
        return laneX;
    }

    public double laneWidth() {
        return laneWidth;
    }

    public int rankCount() {
        return rankX.length;
    }

    public double rankX(int rank) {
        return rankX[rank];
    }

    public double rankWidth(int rank) {
        return rankWidth[rank];
    }

    /**
     * Left end of the free channel after a rank: the right edge of its widest node.
     */
    public double gapStart(int rank) {
        return rankX[rank] + (rankWidth[rank] - rankContentWidth[rank]) / 2 + rankContentWidth[rank];
    }

    /**
     * Right end of the free channel after a rank: the left edge of the next rank's widest node.
     */
    public double gapEnd(int rank) {
        return channelEnd(rank + 1);
    }

    /**
     * Left end of the node-free band just left of a rank's widest node.
     * For rank r > 0 this is the gap after rank r - 1; rank 0 uses its own left padding.
     */
    public double channelStart(int rank) {
        return rank == 0 ? rankX[0] : gapStart(rank - 1);
    }

    /** Right end of the node-free band left of a rank: the left edge of its widest node. */
    public double channelEnd(int rank) {
        return rankX[rank] + (rankWidth[rank] - rankContentWidth[rank]) / 2;
    }

    /** Smallest node y, or 0 when there are no nodes. */
    public double minNodeTop() {
        if (nodeY.length == 0) {
            return 0;
        }
        double top = Double.MAX_VALUE;
        for (double y : nodeY) {
            top = Math.min(top, y);
        }
        return top;
    }

    public double scale() {
        return scale;
    }

    /** Node bounds: maximum x + width over all nodes. */
    public double width() {
        return width;
    }

    /** Node bounds: maximum y + height over all nodes. */
    public double height() {
        return height;
    }

    public double canvasWidth() {
        return canvasWidth;
    }

    public double canvasHeight() {
        return canvasHeight;
    }
}
