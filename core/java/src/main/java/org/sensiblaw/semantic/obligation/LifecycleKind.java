package org.sensiblaw.semantic.obligation;

public enum LifecycleKind {
    ACTIVATION,
    TERMINATION;

    public String wireName() {
        return name().toLowerCase();
    }
}
