package io.reminor.core.search.lexical;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record LexicalHit(String title, String snippet, double score) {
    static final String TITLE_PREFIX = "Journal ";
    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    /** Date encoded in the title, if the title carries a valid one. */
    public Optional<LocalDate> date() {
        if (title == null) {
            return Optional.empty();
        }
        Matcher matcher = DATE.matcher(title);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(matcher.group()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
