package org.sensiblaw.semantic.reference;

import org.sensiblaw.semantic.lexicon.LegalLexicon;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic canonicalization of reference text: NFKC (ligatures), case folding,
 * OCR digit-gap repair in years, roman numerals in designators, bracketed jurisdictions.
 */
public final class ReferenceCanonicalizer {

    private static final Pattern YEAR = Pattern.compile("\\b(1[2-9]\\d{2}|20\\d{2}|21\\d{2})\\b");
    private static final Pattern DIGIT_GAP = Pattern.compile("\\b(\\d{1,3}) (\\d{1,3})\\b");
    private static final Pattern BRACKETED = Pattern.compile("\\(([^)]*)\\)|\\[([^]]*)]");
    private static final Pattern LEADING_ENUMERATOR = Pattern.compile("^\\(?(?:[ivxlcdm]+|[a-z])[.)]\\s*");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w&-]+");
    private static final Pattern ROMAN = Pattern.compile("[ivxlcdm]+");
    private static final Map<Character, Integer> ROMAN_VALUES =
            Map.of('i', 1, 'v', 5, 'x', 10, 'l', 50, 'c', 100, 'd', 500, 'm', 1000);

    private final LegalLexicon lexicon;

    public ReferenceCanonicalizer() {
        this(LegalLexicon.defaults());
    }

    public ReferenceCanonicalizer(LegalLexicon lexicon) {
        this.lexicon = lexicon;
    }

    /** NFKC, lower case, single spaces, OCR-split year digits rejoined. */
    public String fold(String text) {
        if (text == null) return "";
        String s = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase().strip();
        s = s.replaceAll("\\s+", " ");
        return joinDigitGaps(s);
    }

    /**
     * Canonical work text: bracket contents kept as words, punctuation removed, leading
     * enumerators and a leading article dropped.
     */
    public String canonicalWork(String work) {
        String s = fold(work);
        s = LEADING_ENUMERATOR.matcher(s).replaceFirst("");
        s = s.replaceAll("[()\\[\\]{}]", " ");
        s = NON_WORD.matcher(s).replaceAll(" ").replaceAll("\\s+", " ").strip();
        if (s.startsWith("the ")) s = s.substring(4);
        return s;
    }

    public Integer year(String work) {
        Matcher m = YEAR.matcher(fold(work));
        return m.find() ? Integer.valueOf(m.group(1)) : null;
    }

    /** Jurisdiction code from a bracketed hint such as {@code (NSW)} or {@code (N.S.W.)}, else {@code null}. */
    public String jurisdiction(String work) {
        Matcher m = BRACKETED.matcher(fold(work));
        while (m.find()) {
            String inner = m.group(1) != null ? m.group(1) : m.group(2);
            String key = inner.replace(".", "").replaceAll("\\s+", " ").strip();
            String code = lexicon.jurisdictions().get(key);
            if (code != null) return code;
        }
        return null;
    }

    /** Work family: canonical words with the year and jurisdiction hint removed, joined by hyphens. */
    public String workFamily(String work) {
        String s = fold(work);
        Matcher m = BRACKETED.matcher(s);
        StringBuilder kept = new StringBuilder();
        while (m.find()) {
            String inner = m.group(1) != null ? m.group(1) : m.group(2);
            String key = inner.replace(".", "").replaceAll("\\s+", " ").strip();
            m.appendReplacement(kept, lexicon.jurisdictions().containsKey(key) ? " " : Matcher.quoteReplacement(" " + inner + " "));
        }
        m.appendTail(kept);
        String canonical = canonicalWork(YEAR.matcher(kept.toString()).replaceAll(" "));
        return String.join("-", canonical.isEmpty() ? List.of() : Arrays.asList(canonical.split(" ")));
    }

    /**
     * Canonical provision: designator folded through the lexicon, roman numbers converted
     * to arabic for designators that use them. {@code "Part IV"} and {@code "pt 4"} both
     * yield {@code "part 4"}.
     */
    public String canonicalSection(String section) {
        String s = fold(section);
        if (s.isEmpty()) return "";
        String[] parts = s.split(" ", 2);
        if (parts.length == 1) return parts[0];
        String designator = lexicon.designators().getOrDefault(parts[0].replace(".", ""), parts[0]);
        return designator + " " + canonicalNumber(designator, parts[1]);
    }

    public String canonicalNumber(String designator, String number) {
        String n = fold(number).replace(" ", "");
        if (designator != null && lexicon.romanDesignators().contains(designator) && ROMAN.matcher(n).matches()) {
            return Integer.toString(romanToInt(n));
        }
        return n;
    }

    public String canonicalPinpoint(String pinpoint) {
        return fold(pinpoint).replace(" ", "");
    }

    static int romanToInt(String roman) {
        int total = 0;
        int previous = 0;
        for (int i = roman.length() - 1; i >= 0; i--) {
            int value = ROMAN_VALUES.get(roman.charAt(i));
            total += value < previous ? -value : value;
            previous = Math.max(previous, value);
        }
        return total;
    }

    private static String joinDigitGaps(String s) {
        // "19 00" -> "1900" when the pieces add up to a four-digit number
        Matcher m = DIGIT_GAP.matcher(s);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String joined = m.group(1) + m.group(2);
            m.appendReplacement(out, joined.length() == 4 ? joined : Matcher.quoteReplacement(m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }
}
