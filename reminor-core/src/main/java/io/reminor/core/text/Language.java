package io.reminor.core.text;

import java.util.List;
import java.util.Locale;

/**
 * Journal languages understood by the temporal resolver, the keyword tables and the
 * context labels.
 */
public enum Language {
    ITALIAN(
        "it",
        List.of("gennaio", "febbraio", "marzo", "aprile", "maggio", "giugno",
            "luglio", "agosto", "settembre", "ottobre", "novembre", "dicembre"),
        List.of("lunedì", "lunedi", "martedì", "martedi", "mercoledì", "mercoledi",
            "giovedì", "giovedi", "venerdì", "venerdi", "sabato", "domenica"),
        "Voci correlate",
        "rilevanza",
        "Diario"
    ),
    ENGLISH(
        "en",
        List.of("january", "february", "march", "april", "may", "june",
            "july", "august", "september", "october", "november", "december"),
        List.of("monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday"),
        "Related entries",
        "relevance",
        "Journal"
    );

    private final String code;
    private final List<String> months;
    private final List<String> weekdays;
    private final String relatedEntriesHeading;
    private final String relevanceLabel;
    private final String journalLabel;

    Language(
        String code,
        List<String> months,
        List<String> weekdays,
        String relatedEntriesHeading,
        String relevanceLabel,
        String journalLabel
    ) {
        this.code = code;
        this.months = months;
        this.weekdays = weekdays;
        this.relatedEntriesHeading = relatedEntriesHeading;
        this.relevanceLabel = relevanceLabel;
        this.journalLabel = journalLabel;
    }

    public String code() {
        return code;
    }

    /** Lower-case month names, January first. */
    public List<String> months() {
        return months;
    }

    public List<String> weekdays() {
        return weekdays;
    }

    public String relatedEntriesHeading() {
        return relatedEntriesHeading;
    }

    public String relevanceLabel() {
        return relevanceLabel;
    }

    public String journalLabel() {
        return journalLabel;
    }

    /**
     * @return month number 1-12, or 0 when {@code word} is not a month name in this language
     */
    public int monthNumber(String word) {
        if (word == null) {
            return 0;
        }
        return months.indexOf(word.toLowerCase(Locale.ROOT)) + 1;
    }

    public static Language fromCode(String code) {
        if (code == null || code.isBlank()) {
            return ITALIAN;
        }
        for (Language language : values()) {
            if (language.code.equalsIgnoreCase(code.trim())) {
                return language;
            }
        }
        throw new IllegalArgumentException("unsupported language: " + code);
    }
}
