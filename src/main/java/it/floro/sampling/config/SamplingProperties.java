package it.floro.sampling.config;

import it.floro.sampling.domain.FrequencyUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * Configurazione dell'analisi di frequenza di campionamento (prefisso "sampling").
 *
 * @param firstYear Primo anno della finestra di conteggio; l'ultimo è l'anno della data di esecuzione
 * @param defaultUnit Unità usata quando la richiesta non ne specifica una
 * @param zone Fuso orario per "oggi" e per le date istantanee in ingresso (null = fuso di sistema)
 * @param projection Parametri della proiezione delle date future
 * @param export Parametri dell'esportazione
 */
@ConfigurationProperties(prefix = "sampling")
public record SamplingProperties(
        @DefaultValue("2021") int firstYear,
        @DefaultValue("MONTHS") FrequencyUnit defaultUnit,
        ZoneId zone,
        @DefaultValue Projection projection,
        @DefaultValue Export export
) {

    public SamplingProperties {
        if (zone == null) {
            zone = ZoneId.systemDefault();
        }
    }

    /**
     * @param horizonYearsAhead L'orizzonte è il 31 dicembre dell'anno di esecuzione + questo valore
     * @param fallbackIntervalDays Intervallo per gli equipaggiamenti senza raccomandazione (0 = esclusi)
     * @param nonBusinessDays Giorni su cui non si campiona: la data slitta al primo giorno utile
     */
    public record Projection(
            @DefaultValue("1") int horizonYearsAhead,
            @DefaultValue("0") int fallbackIntervalDays,
            @DefaultValue({"SATURDAY", "SUNDAY"}) Set<DayOfWeek> nonBusinessDays
    ) {

        public Projection {
            if (horizonYearsAhead < 0) {
                throw new IllegalArgumentException("sampling.projection.horizon-years-ahead non può essere negativo");
            }
            nonBusinessDays = nonBusinessDays == null || nonBusinessDays.isEmpty()
                    ? Set.of()
                    : Set.copyOf(EnumSet.copyOf(nonBusinessDays));
            if (nonBusinessDays.size() == DayOfWeek.values().length) {
                throw new IllegalArgumentException("sampling.projection.non-business-days non può contenere tutti i giorni");
            }
        }
    }

    /**
     * @param fileName Nome base dei file scaricati (senza estensione)
     */
    public record Export(@DefaultValue("sampling_median_recommendation") String fileName) {}

    /**
     * Configurazione con i valori di default, usata nei test senza contesto Spring.
     */
    public static SamplingProperties defaults() {
        return new SamplingProperties(2021, FrequencyUnit.MONTHS, ZoneId.systemDefault(),
                new Projection(1, 0, EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY)),
                new Export("sampling_median_recommendation"));
    }
}
