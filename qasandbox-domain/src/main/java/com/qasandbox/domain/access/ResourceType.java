package com.qasandbox.domain.access;

public enum ResourceType {
    USER("User"),
    CATEGORY("Category"),
    PRODUCT("Product"),
    ORDER("Order"),
    ADMIN_OPS("Admin operation");

    private final String displayName;

    ResourceType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
