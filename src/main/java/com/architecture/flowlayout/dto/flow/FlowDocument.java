package com.architecture.flowlayout.dto.flow;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured business flow handed to the layout engine.
 * The document is expected to be schema-valid; the engine only checks references.
 * Accepts the legacy field names (actors, tasks, flows) as aliases.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowDocument {

    private FlowMetadata metadata;

    @Builder.Default
    @JsonAlias("actors")
    private List<FlowRole> roles = new ArrayList<>();

    @Builder.Default
    @JsonAlias("tasks")
    private List<FlowActivity> activities = new ArrayList<>();

    @Builder.Default
    private List<FlowGateway> gateways = new ArrayList<>();

    @Builder.Default
    @JsonAlias("flows")
    private List<FlowTransition> transitions = new ArrayList<>();
}
