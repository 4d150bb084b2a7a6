package com.metbull.sync.reconcile.model;

public record StopDecision(boolean stop, StopReason reason, String detail) {
    private static final StopDecision CONTINUE = new StopDecision(false, null, null);

    public static StopDecision proceed() {
        return CONTINUE;
    }

    public static StopDecision stop(StopReason reason, String detail) {
        return new StopDecision(true, reason, detail);
    }
}
