package com.architecture.flowlayout.dto.flow;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A unit of work performed by exactly one role.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowActivity {

    private String id;
    private String name;

    @JsonAlias({"actorId", "actor_id", "role_id"})
    private String roleId;

    @JsonAlias("phase_id")
    private String phaseId;

    private String notes;
}
