package com.tapas.drivertips.consumer;

import com.tapas.drivertips.domain.TipEvent;
import com.tapas.drivertips.dto.TipEventPayload;
import com.tapas.drivertips.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Set;

/**
 * Turns a decoded payload into a {@link TipEvent}, or rejects it with a
 * {@link ValidationException} listing every problem found.
 */
@Component
public class TipEventValidator {

    private static final String INVALID_EVENT = "Invalid tip event";

    // 2024-01-15, 2024-01-15T10:30:00 or 2024-01-15T10:30:00.123Z / +02:00
    private static final DateTimeFormatter EVENT_TIME_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private final Validator validator;

    public TipEventValidator(Validator validator) {
        this.validator = validator;
    }

    public TipEvent validate(TipEventPayload payload) {
        if (payload == null) {
            throw new ValidationException(INVALID_EVENT, List.of("payload must be a JSON object"));
        }

        Set<ConstraintViolation<TipEventPayload>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            throw new ValidationException(INVALID_EVENT, violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList());
        }

        return new TipEvent(payload.driverId(), payload.amount(), parseEventTime(payload.eventTime()));
    }

    static Instant parseEventTime(String value) {
        try {
            TemporalAccessor parsed = EVENT_TIME_FORMAT.parseBest(value.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException(INVALID_EVENT,
                    List.of("eventTime: eventTime must be a valid ISO 8601 datetime"));
        }
    }
}
