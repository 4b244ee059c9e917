package com.architecture.flowlayout.dto.layout;

public enum NodeKind {
    ACTIVITY,   // rectangle
    GATEWAY     // diamond
}
