package com.bidplatform.common.validation;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Converts a delivery date string to an {@link Instant}.
 *
 * <p>Accepted forms, tried in order:
 * <ol>
 *   <li>ISO instant: {@code 2024-03-01T10:00:00Z}</li>
 *   <li>Offset date-time: {@code 2024-03-01T10:00:00+02:00}</li>
 *   <li>Local date-time, read as UTC: {@code 2024-03-01T10:00:00}</li>
 *   <li>Local date, start of day UTC: {@code 2024-03-01}</li>
 * </ol>
 */
public final class DeliveryDateParser {

    private static final List<Function<String, Instant>> FORMS = List.of(
        Instant::parse,
        v -> OffsetDateTime.parse(v).toInstant(),
        v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
        v -> LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private DeliveryDateParser() {}

    /**
     * @return the parsed instant, or empty when the text is blank or matches no accepted form
     */
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        for (Function<String, Instant> form : FORMS) {
            try {
                return Optional.of(form.apply(value));
            } catch (DateTimeParseException e) {
                // not this form
            }
        }
        return Optional.empty();
    }
}
