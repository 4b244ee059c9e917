package com.architecture.flowlayout.dto.flow;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A directed sequence flow between two activities and/or gateways.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowTransition {

    private String id;

    @JsonAlias({"from", "sourceId"})
    private String source;

    @JsonAlias({"to", "targetId"})
    private String target;

    private String condition;   // Optional branch condition, e.g. "approved"
    private String name;
}
