package com.architecture.flowlayout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String code;            // UNRESOLVED_REFERENCE, BAD_REQUEST, INTERNAL_ERROR
    private String message;
    private String transitionId;
    private String missingNodeId;
}
