package org.dxworks.sqlportability.model.template;

public final class SafetyVerdict {
    public final boolean canRewrite;
    public final String reason;

    public SafetyVerdict(boolean canRewrite, String reason) {
        this.canRewrite = canRewrite;
        this.reason = reason;
    }
}
