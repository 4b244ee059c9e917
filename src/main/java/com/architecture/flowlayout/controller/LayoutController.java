package com.architecture.flowlayout.controller;

import com.architecture.flowlayout.dto.flow.FlowDocument;
import com.architecture.flowlayout.dto.layout.LayoutModel;
import com.architecture.flowlayout.dto.layout.LayoutNote;
import com.architecture.flowlayout.service.layout.FlowLayoutEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for computing swimlane diagram layouts.
 */
@RestController
@RequestMapping("/api/layout")
@RequiredArgsConstructor
@Slf4j
public class LayoutController {

    private final FlowLayoutEngine layoutEngine;

    /**
     * Lay out a flow document.
     * Returns node coordinates, lane bands, routed edges and any advisory notes.
     */
    @PostMapping
    public ResponseEntity<LayoutModel> layout(@RequestBody FlowDocument document) {
        String flowId = document.getMetadata() != null ? document.getMetadata().getId() : null;
        log.info("Computing layout for flow: {}", flowId);

        LayoutModel model = layoutEngine.layout(document);
        for (LayoutNote note : model.getNotes()) {
            log.warn("Layout note for flow {}: [{}] {}", flowId, note.getType(), note.getMessage());
        }
        return ResponseEntity.ok(model);
    }
}
