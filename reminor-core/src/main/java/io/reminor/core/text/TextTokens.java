package io.reminor.core.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextTokens {
    private static final Pattern WORD = Pattern.compile("[\\p{L}]+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

    private TextTokens() {
    }

    /** Lower-cased letter runs; punctuation and digits act as separators. */
    public static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        List<String> out = new ArrayList<>();
        while (matcher.find()) {
            out.add(matcher.group());
        }
        return out;
    }

    /** Words of at least {@code minLength} characters that are not stopwords. */
    public static List<String> keywords(String text, int minLength) {
        List<String> out = new ArrayList<>();
        for (String word : words(text)) {
            if (word.length() >= minLength && !isStopword(word)) {
                out.add(word);
            }
        }
        return out;
    }

    /** Whitespace split with leading and trailing punctuation removed, lower-cased. */
    public static List<String> bareTokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String raw : text.trim().split("\\s+")) {
            String cleaned = EDGE_PUNCTUATION.matcher(raw).replaceAll("").toLowerCase(Locale.ROOT);
            if (cleaned.endsWith("'s")) {
                cleaned = cleaned.substring(0, cleaned.length() - 2);
            }
            if (!cleaned.isEmpty()) {
                out.add(cleaned);
            }
        }
        return out;
    }

    public static boolean isStopword(String word) {
        return STOP_WORDS.contains(word);
    }

    /** Month number 1-12 in any supported language, or 0. */
    public static int monthNumber(String word) {
        for (Language language : Language.values()) {
            int month = language.monthNumber(word);
            if (month > 0) {
                return month;
            }
        }
        return 0;
    }

    public static boolean isCalendarWord(String word) {
        String lowered = word.toLowerCase(Locale.ROOT);
        if (monthNumber(lowered) > 0) {
            return true;
        }
        for (Language language : Language.values()) {
            if (language.weekdays().contains(lowered)) {
                return true;
            }
        }
        return TEMPORAL_WORDS.contains(lowered);
    }

    /** Non-overlapping occurrences of {@code needle} in {@code haystack}. */
    public static int countOccurrences(String haystack, String needle) {
        if (haystack == null || needle == null || needle.isEmpty()) {
            return 0;
        }
        int count = 0;
        int index = haystack.indexOf(needle);
        while (index >= 0) {
            count++;
            index = haystack.indexOf(needle, index + needle.length());
        }
        return count;
    }

    private static final Set<String> TEMPORAL_WORDS = Set.of(
        "oggi", "ieri", "domani", "stamattina", "stasera", "stanotte",
        "today", "yesterday", "tomorrow", "tonight", "morning", "evening", "afternoon"
    );

    private static final Set<String> STOP_WORDS = Set.of(
        // italian
        "il", "lo", "la", "gli", "le", "un", "uno", "una", "dei", "degli", "delle",
        "di", "da", "in", "con", "su", "per", "tra", "fra", "del", "della", "dello",
        "al", "alla", "allo", "ai", "agli", "alle", "dal", "dalla", "nel", "nella", "nei",
        "sul", "sulla", "che", "chi", "cosa", "come", "dove", "quando", "perché", "perche",
        "ma", "se", "non", "più", "piu", "anche", "solo", "poi", "già", "gia",
        "mi", "ti", "ci", "vi", "si", "me", "te", "lui", "lei", "noi", "voi", "loro",
        "mio", "mia", "tuo", "tua", "suo", "sua", "nostro", "vostro",
        "questo", "questa", "quello", "quella", "quale", "quanto", "tutto", "tutti", "ogni",
        "sono", "sei", "era", "ero", "stato", "stata", "ho", "hai", "ha", "abbiamo", "hanno",
        "conosci", "sai", "dimmi", "parlami", "raccontami", "dici", "successo",
        // english
        "the", "and", "or", "is", "are", "was", "were", "to", "of", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being",
        "as", "if", "but", "not", "no", "you", "your", "we", "our", "they", "their",
        "he", "she", "his", "her", "him", "my", "mine", "an", "a", "i",
        "what", "which", "who", "whom", "whose", "when", "where", "why", "how",
        "did", "do", "does", "done", "had", "has", "have", "happened", "happen",
        "about", "tell", "know", "there", "then", "than", "so", "too", "very", "can",
        "could", "would", "should", "will", "just", "any", "all", "some", "into", "out",
        "after", "before", "again", "also", "its", "us"
    );
}
