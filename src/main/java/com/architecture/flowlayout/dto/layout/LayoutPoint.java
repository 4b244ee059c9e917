package com.architecture.flowlayout.dto.layout;

import lombok.Value;

@Value(staticConstructor = "of")
public class LayoutPoint {

    double x;
    double y;
}
