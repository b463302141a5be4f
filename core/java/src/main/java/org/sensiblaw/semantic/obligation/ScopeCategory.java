package org.sensiblaw.semantic.obligation;

public enum ScopeCategory {
    TIME,
    PLACE,
    CONTEXT;

    public String wireName() {
        return name().toLowerCase();
    }

    public static ScopeCategory fromWire(String category) {
        return valueOf(category.toUpperCase());
    }
}
