package org.sensiblaw.semantic.obligation;

public enum ConditionType {
    IF,
    UNLESS,
    EXCEPT,
    SUBJECT_TO,
    PROVIDED_THAT;

    public String wireName() {
        return name().toLowerCase();
    }

    /** UNLESS and EXCEPT carve an exception out of the duty; the rest condition it. */
    public boolean isException() {
        return this == UNLESS || this == EXCEPT;
    }

    public static ConditionType fromTag(String tag) {
        for (ConditionType type : values()) {
            if (type.wireName().equals(tag)) return type;
        }
        throw new IllegalArgumentException("Unknown condition type '" + tag + "'");
    }
}
