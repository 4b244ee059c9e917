package com.architecture.flowlayout.dto.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A branch or merge point. Gateways carry no role; their lane is derived from neighbours.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowGateway {

    private String id;
    private String name;
    private GatewayType type;
    private String notes;
}
