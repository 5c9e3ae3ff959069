package org.dxworks.sqlportability.model.template;

public enum RegionKind {
    STATIC,
    SAFE_EXPRESSION,
    CONTROL_FLOW,
    UNSAFE
}
