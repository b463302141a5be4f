package org.sensiblaw.semantic.obligation;

public enum ObligationType {
    OBLIGATION,
    PERMISSION,
    PROHIBITION,
    EXCLUSION;

    public String wireName() {
        return name().toLowerCase();
    }

    /** Maps a modal lexicon tag such as {@code prohibition} to its type. */
    public static ObligationType fromTag(String tag) {
        for (ObligationType type : values()) {
            if (type.wireName().equals(tag)) return type;
        }
        throw new IllegalArgumentException("Unknown modality type '" + tag + "'");
    }
}
