package com.tracura.plm.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Calendar-date codec for the store boundary. Documents keep dates as {@code dd/MM/yyyy} text;
 * everything above the repositories works with {@link LocalDate}.
 */
public final class StoreDates {

    private static final Logger log = LoggerFactory.getLogger(StoreDates.class);

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("dd/MM/uuuu")
        .withResolverStyle(ResolverStyle.STRICT);

    private StoreDates() {
    }

    /**
     * Parse a stored date. Blank and unparseable values are treated as absent.
     */
    public static Optional<LocalDate> parse(String stored) {
        if (stored == null || stored.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(stored.trim(), FORMAT));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable stored date '{}'", stored);
            return Optional.empty();
        }
    }

    public static String format(LocalDate date) {
        return date != null ? FORMAT.format(date) : null;
    }

    public static String format(Optional<LocalDate> date) {
        return date.map(FORMAT::format).orElse(null);
    }
}
