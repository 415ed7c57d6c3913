package it.floro.sampling.service;

import it.floro.sampling.config.SamplingProperties;
import it.floro.sampling.domain.EquipmentKey;
import it.floro.sampling.domain.ProjectionRow;
import it.floro.sampling.domain.RecommendationRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Proiezione del calendario dei prossimi campionamenti.
 *
 * Per ogni equipaggiamento con intervallo definito:
 * 1. start = max(data di esecuzione, ultima data di campionamento)
 * 2. next = start
 * 3. next += intervallo; se next cade in un giorno non lavorativo slitta al primo giorno utile
 * 4. next viene emessa finché non supera l'orizzonte (31/12 dell'anno di esecuzione + N)
 *
 * L'intervallo in giorni è la mediana arrotondata al giorno intero più vicino (HALF_UP).
 * Gli intervalli inferiori a un giorno vengono scartati: il ciclo non avanzerebbe.
 */
@Component
public class FutureDateProjector {

    private static final Logger logger = LoggerFactory.getLogger(FutureDateProjector.class);

    private final BusinessDayPolicy businessDays;
    private final int horizonYearsAhead;
    private final int fallbackIntervalDays;

    @Autowired
    public FutureDateProjector(SamplingProperties properties) {
        this(new BusinessDayPolicy(properties.projection().nonBusinessDays()),
                properties.projection().horizonYearsAhead(),
                properties.projection().fallbackIntervalDays());
    }

    public FutureDateProjector(BusinessDayPolicy businessDays, int horizonYearsAhead, int fallbackIntervalDays) {
        this.businessDays = businessDays;
        this.horizonYearsAhead = horizonYearsAhead;
        this.fallbackIntervalDays = fallbackIntervalDays;
    }

    /**
     * @param runDate Data di esecuzione
     * @return 31 dicembre dell'anno di esecuzione + anni configurati
     */
    public LocalDate horizonFor(LocalDate runDate) {
        return LocalDate.of(runDate.getYear() + horizonYearsAhead, 12, 31);
    }

    /**
     * Genera le date future per tutti gli equipaggiamenti raccomandati.
     *
     * @param recommendations Raccomandazioni per equipaggiamento
     * @param lastDates Ultima data di campionamento per chiave (prevale su quella della raccomandazione)
     * @param runDate Data di esecuzione ("oggi")
     * @return Sequenza piatta ordinata per chiave e data
     */
    public List<ProjectionRow> project(List<RecommendationRow> recommendations,
                                       Map<EquipmentKey, LocalDate> lastDates,
                                       LocalDate runDate) {
        LocalDate horizon = horizonFor(runDate);
        List<ProjectionRow> out = new ArrayList<>();
        int skipped = 0;

        for (RecommendationRow rec : recommendations) {
            Long intervalDays = intervalDaysOf(rec);
            if (intervalDays == null) {
                skipped++;
                logger.debug("Nessuna proiezione per {}: raccomandazione non definita", rec.key().label());
                continue;
            }
            if (intervalDays < 1) {
                skipped++;
                logger.warn("Nessuna proiezione per {}: intervallo di {} giorni non valido",
                        rec.key().label(), intervalDays);
                continue;
            }

            LocalDate last = lastDates.getOrDefault(rec.key(), rec.lastSampleDate());
            LocalDate next = (last != null && last.isAfter(runDate)) ? last : runDate;

            while (true) {
                next = businessDays.rollForward(next.plusDays(intervalDays));
                if (next.isAfter(horizon)) break;
                out.add(new ProjectionRow(rec.key(), rec.assetClass(), rec.accountName(), next));
            }
        }

        if (skipped > 0) {
            logger.info("Proiezione: {} equipaggiamenti esclusi, {} date generate fino al {}",
                    skipped, out.size(), horizon);
        }
        return out;
    }

    /**
     * Intervallo in giorni usato dalla proiezione: mediana arrotondata, oppure
     * l'intervallo di ripiego configurato se la raccomandazione manca.
     *
     * @return Giorni, o null se l'equipaggiamento va escluso
     */
    Long intervalDaysOf(RecommendationRow rec) {
        if (rec.hasRecommendation()) {
            return Math.round(rec.medianIntervalDays());
        }
        return fallbackIntervalDays > 0 ? (long) fallbackIntervalDays : null;
    }
}
