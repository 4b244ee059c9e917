package com.architecture.flowlayout.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the layout engine.
 * Reads node sizes, spacing and sweep/scale limits from application.yml properties.
 */
@Configuration
@Slf4j
public class LayoutConfig {

    @Value("${layout.node.activity-min-width:120}")
    private double activityMinWidth;

    @Value("${layout.node.activity-height:80}")
    private double activityHeight;

    @Value("${layout.node.gateway-size:60}")
    private double gatewaySize;

    @Value("${layout.text.char-width:8}")
    private double charWidth;

    @Value("${layout.text.padding:16}")
    private double labelPadding;

    @Value("${layout.spacing.horizontal-gap:80}")
    private double horizontalGap;

    @Value("${layout.spacing.vertical-gap:20}")
    private double verticalGap;

    @Value("${layout.lane.min-height:150}")
    private double minLaneHeight;

    @Value("${layout.lane.header-width:180}")
    private double laneHeaderWidth;

    @Value("${layout.margin.x:50}")
    private double marginX;

    @Value("${layout.margin.y:50}")
    private double marginY;

    @Value("${layout.crossing.max-sweeps:4}")
    private int maxSweeps;

    @Value("${layout.scale.enabled:true}")
    private boolean scaleEnabled;

    @Value("${layout.scale.reference-node-count:10}")
    private int scaleReferenceNodeCount;

    @Value("${layout.scale.min:1.0}")
    private double minScale;

    @Value("${layout.scale.max:2.0}")
    private double maxScale;

    /**
     * Layout constants used by every engine stage.
     * Invalid values fail application startup.
     */
    @Bean
    public LayoutSettings layoutSettings() {
        LayoutSettings settings = LayoutSettings.builder()
                .activityMinWidth(activityMinWidth)
                .activityHeight(activityHeight)
                .gatewaySize(gatewaySize)
                .charWidth(charWidth)
                .labelPadding(labelPadding)
                .horizontalGap(horizontalGap)
                .verticalGap(verticalGap)
                .minLaneHeight(minLaneHeight)
                .laneHeaderWidth(laneHeaderWidth)
                .marginX(marginX)
                .marginY(marginY)
                .maxSweeps(maxSweeps)
                .scaleEnabled(scaleEnabled)
                .scaleReferenceNodeCount(scaleReferenceNodeCount)
                .minScale(minScale)
                .maxScale(maxScale)
                .build()
                .validate();

        log.info("[Layout Config] Initialized layout settings: sweeps={}, hGap={}, vGap={}, scaleEnabled={}",
                maxSweeps, horizontalGap, verticalGap, scaleEnabled);
        return settings;
    }
}
