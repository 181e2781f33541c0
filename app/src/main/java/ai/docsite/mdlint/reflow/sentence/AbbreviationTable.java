package ai.docsite.mdlint.reflow.sentence;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Words whose trailing period does not end a sentence. Lookups are exact, case-insensitive matches
 * of a whole word, so {@code paradigms} is never mistaken for {@code ms}.
 */
public final class AbbreviationTable {

    public static final Set<String> BUILT_IN = Set.of("mr", "mrs", "ms", "dr", "prof", "sr", "jr", "i.e", "e.g");

    private static final AbbreviationTable DEFAULTS = new AbbreviationTable(BUILT_IN);

    private final Set<String> entries;

    private AbbreviationTable(Set<String> entries) {
        this.entries = Set.copyOf(entries);
    }

    public static AbbreviationTable defaults() {
        return DEFAULTS;
    }

    /**
     * Built-in abbreviations extended with user entries; a trailing period on an entry is optional.
     */
    public static AbbreviationTable withCustom(Collection<String> custom) {
        if (custom == null || custom.isEmpty()) {
            return DEFAULTS;
        }
        Set<String> merged = new LinkedHashSet<>(BUILT_IN);
        for (String entry : custom) {
            String normalized = normalize(entry);
            if (!normalized.isEmpty()) {
                merged.add(normalized);
            }
        }
        return new AbbreviationTable(merged);
    }

    /**
     * True when {@code word}, the text before a sentence-ending period, is an abbreviation. Only the
     * configured entries have their periods stripped, so {@code Mr.} (from {@code Mr..}) never matches.
     */
    public boolean contains(CharSequence word) {
        return word != null && word.length() > 0 && entries.contains(word.toString().toLowerCase(Locale.ROOT));
    }

    private static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '.') {
            end--;
        }
        return value.substring(0, end).toLowerCase(Locale.ROOT);
    }
}
