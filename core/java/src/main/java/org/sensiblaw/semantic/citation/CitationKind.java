package org.sensiblaw.semantic.citation;

/** Surface shape of a recognised citation. */
public enum CitationKind {
    /** Named instrument, e.g. {@code Crimes Act 1900 (NSW)}, optionally with a provision. */
    ACT,
    /** Bare provision designator, e.g. {@code Part 4} or {@code s 5(2)}; refers into the same document. */
    PROVISION,
    /** Medium-neutral citation, e.g. {@code [1992] HCA 23}. */
    NEUTRAL_CITATION,
    /** Law report citation, e.g. {@code (1992) 175 CLR 1}. */
    LAW_REPORT;

    public String wireName() {
        return name().toLowerCase();
    }
}
