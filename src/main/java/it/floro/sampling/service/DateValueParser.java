package it.floro.sampling.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Conversione del valore grezzo di "Date Sampled" in una data di calendario.
 *
 * I formati testuali vengono provati nell'ordine di registrazione; il primo che
 * interpreta l'intera stringa vince. Le forme con barra sono mese-prima (formato
 * MobilServ statunitense), salvo quelle che iniziano con l'anno.
 *
 * La risoluzione è STRICT: una data inesistente (31 febbraio, 31 aprile) non viene
 * corretta al giorno valido più vicino ma rifiutata.
 */
public final class DateValueParser {

    private static final Locale DEFAULT_LOCALE = Locale.US;

    /** Formati con sola data. */
    private static final List<DateTimeFormatter> DATE_FORMATTERS = new ArrayList<>();

    /** Formati con data e ora: l'ora viene scartata. */
    private static final List<DateTimeFormatter> DATE_TIME_FORMATTERS = new ArrayList<>();

    static {
        registerDate("uuuu-MM-dd", "uuuu/MM/dd", "M/d/uuuu", "M-d-uuuu", "d-MMM-uuuu", "d MMM uuuu", "uuuuMMdd");
        registerDateTime(
                "uuuu-MM-dd'T'HH:mm[:ss][.SSS]",
                "uuuu-MM-dd HH:mm[:ss][.SSS]",
                "uuuu/MM/dd HH:mm[:ss]",
                "M/d/uuuu H:mm[:ss]",
                "M/d/uuuu h:mm[:ss] a"
        );
    }

    private DateValueParser() {
    }

    /**
     * Converte un valore grezzo in data.
     *
     * @param raw Valore della cella: String, LocalDate, LocalDateTime, Date, Instant, ... o null
     * @param zone Fuso usato per i valori istantanei (Date, Instant)
     * @return Data interpretata, oppure vuoto se il valore manca o non è riconosciuto
     */
    public static Optional<LocalDate> parse(Object raw, ZoneId zone) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof LocalDate d) {
            return Optional.of(d);
        }
        if (raw instanceof LocalDateTime dt) {
            return Optional.of(dt.toLocalDate());
        }
        if (raw instanceof OffsetDateTime odt) {
            return Optional.of(odt.atZoneSameInstant(zone).toLocalDate());
        }
        if (raw instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.withZoneSameInstant(zone).toLocalDate());
        }
        if (raw instanceof Instant i) {
            return Optional.of(LocalDate.ofInstant(i, zone));
        }
        if (raw instanceof java.sql.Date sd) {
            return Optional.of(sd.toLocalDate());
        }
        if (raw instanceof Date d) {
            return Optional.of(LocalDate.ofInstant(d.toInstant(), zone));
        }
        if (raw instanceof CharSequence cs) {
            return parseText(cs.toString());
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> parseText(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return Optional.of(LocalDate.parse(trimmed, formatter));
            } catch (DateTimeParseException ignored) {
                // prova il formato successivo
            }
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            try {
                return Optional.of(LocalDateTime.parse(trimmed, formatter).toLocalDate());
            } catch (DateTimeParseException ignored) {
                // prova il formato successivo
            }
        }
        return Optional.empty();
    }

    private static void registerDate(String... patterns) {
        for (String pattern : patterns) {
            DATE_FORMATTERS.add(formatter(pattern));
        }
    }

    private static void registerDateTime(String... patterns) {
        for (String pattern : patterns) {
            DATE_TIME_FORMATTERS.add(formatter(pattern));
        }
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(DEFAULT_LOCALE)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
