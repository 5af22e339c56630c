package com.libragraph.vcl.core.quota;

public record CleanupDecision(boolean needed, String reason) {

    public static CleanupDecision notNeeded(String reason) {
        return new CleanupDecision(false, reason);
    }
}
