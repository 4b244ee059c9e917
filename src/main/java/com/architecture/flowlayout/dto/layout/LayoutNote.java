package com.architecture.flowlayout.dto.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Advisory note attached to a layout model.
 */
@Value
@Builder
public class LayoutNote {

    NoteType type;
    String subjectId;   // transition id for cycles, node id for lane defaults, null otherwise
    String message;
}
