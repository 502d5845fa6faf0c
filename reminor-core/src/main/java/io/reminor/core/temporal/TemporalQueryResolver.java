package io.reminor.core.temporal;

import io.reminor.core.text.Language;
import io.reminor.core.text.TextTokens;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds explicit day references in a free-text question ("15 giugno", "June 15th", "il 3",
 * "yesterday"). Dates come back in the order they are mentioned.
 */
public final class TemporalQueryResolver {
    private static final String MONTHS = monthAlternation();
    private static final String ORDINAL = "(?:st|nd|rd|th|°)?";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern DAY_MONTH = Pattern.compile(
        "\\b(\\d{1,2})" + ORDINAL + "\\s+(?:of\\s+|di\\s+)?(" + MONTHS + ")\\b(?:,?\\s+(\\d{4})\\b)?", FLAGS);
    private static final Pattern MONTH_DAY = Pattern.compile(
        "\\b(" + MONTHS + ")\\s+(?:the\\s+)?(\\d{1,2})" + ORDINAL + "(?!\\d)(?:,?\\s+(\\d{4})\\b)?", FLAGS);
    private static final Pattern DAY_OF_MONTH = Pattern.compile(
        "(?:\\b(?:il|the)\\s+|\\bl')(\\d{1,2})" + ORDINAL + "(?!\\d)(?!\\s+(?:of\\s+|di\\s+)?(?:" + MONTHS + ")\\b)", FLAGS);
    private static final Pattern DAY_BEFORE_YESTERDAY = Pattern.compile(
        "\\b(?:l'altro\\s*ieri|altroieri|the\\s+day\\s+before\\s+yesterday)\\b", FLAGS);
    private static final Pattern YESTERDAY = Pattern.compile("\\b(?:ieri|yesterday)\\b", FLAGS);
    private static final Pattern TODAY = Pattern.compile(
        "\\b(?:oggi|stamattina|stasera|stanotte|today|tonight|this\\s+(?:morning|afternoon|evening))\\b", FLAGS);

    private final Clock clock;
    private final ZoneId zoneId;

    public TemporalQueryResolver(Clock clock, ZoneId zoneId) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId must not be null");
    }

    public static TemporalQueryResolver systemDefault() {
        return new TemporalQueryResolver(Clock.systemDefaultZone(), ZoneId.systemDefault());
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), zoneId);
    }

    public LinkedHashSet<LocalDate> resolve(String query) {
        LinkedHashSet<LocalDate> dates = new LinkedHashSet<>();
        if (query == null || query.isBlank()) {
            return dates;
        }
        String text = query.toLowerCase(Locale.ROOT);
        LocalDate today = today();
        List<Mention> mentions = new ArrayList<>();

        Matcher matcher = DAY_BEFORE_YESTERDAY.matcher(text);
        while (matcher.find()) {
            accept(mentions, matcher, today.minusDays(2));
        }
        matcher = DAY_MONTH.matcher(text);
        while (matcher.find()) {
            accept(mentions, matcher, date(year(matcher.group(3), today), TextTokens.monthNumber(matcher.group(2)), matcher.group(1)));
        }
        matcher = MONTH_DAY.matcher(text);
        while (matcher.find()) {
            accept(mentions, matcher, date(year(matcher.group(3), today), TextTokens.monthNumber(matcher.group(1)), matcher.group(2)));
        }
        matcher = DAY_OF_MONTH.matcher(text);
        while (matcher.find()) {
            accept(mentions, matcher, date(today.getYear(), today.getMonthValue(), matcher.group(1)));
        }
        matcher = YESTERDAY.matcher(text);
        while (matcher.find()) {
            accept(mentions, matcher, today.minusDays(1));
        }
        matcher = TODAY.matcher(text);
        while (matcher.find()) {
            accept(mentions, matcher, today);
        }

        mentions.sort(Comparator.comparingInt(Mention::start));
        for (Mention mention : mentions) {
            if (mention.date() != null) {
                dates.add(mention.date());
            }
        }
        return dates;
    }

    // Earlier patterns own their span; "the day before yesterday" must not also yield yesterday.
    private static void accept(List<Mention> mentions, Matcher matcher, LocalDate date) {
        int start = matcher.start();
        int end = matcher.end();
        for (Mention mention : mentions) {
            if (start < mention.end() && mention.start() < end) {
                return;
            }
        }
        // An invalid date still claims its span so no weaker pattern reinterprets it.
        mentions.add(new Mention(start, end, date));
    }

    private static LocalDate date(int year, int month, String day) {
        if (month < 1) {
            return null;
        }
        try {
            return LocalDate.of(year, month, Integer.parseInt(day));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }

    private static int year(String explicit, LocalDate today) {
        return explicit == null ? today.getYear() : Integer.parseInt(explicit);
    }

    private static String monthAlternation() {
        List<String> names = new ArrayList<>();
        for (Language language : Language.values()) {
            names.addAll(language.months());
        }
        // Longest first so alternation never stops at a prefix.
        names.sort(Comparator.comparingInt(String::length).reversed());
        return String.join("|", names);
    }

    private record Mention(int start, int end, LocalDate date) {
    }
}
