package com.qasandbox.domain.access;

public record AccessDecision(boolean allowed, String reason) {

    private static final AccessDecision ALLOW = new AccessDecision(true, "allowed");

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision deny(String reason) {
        return new AccessDecision(false, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
