package it.floro.sampling.service;

import it.floro.sampling.domain.AnalysisReport;
import it.floro.sampling.domain.EquipmentKey;
import it.floro.sampling.domain.FrequencyUnit;
import it.floro.sampling.domain.NormalizationResult;
import it.floro.sampling.domain.ProjectionRow;
import it.floro.sampling.domain.RawSampleRow;
import it.floro.sampling.domain.RecommendationRow;
import it.floro.sampling.domain.ReportRow;
import it.floro.sampling.domain.TallyRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service centralizzato che esegue un'analisi completa della frequenza di campionamento.
 *
 * Flusso:
 * 1. Filtro per operazione (Account Name)
 * 2. Normalizzazione delle righe (date, scarti)
 * 3. Conteggio annuale dei campioni distinti
 * 4. Raccomandazione della frequenza (mediana degli intervalli)
 * 5. Left join conteggio ↔ raccomandazione
 * 6. Proiezione delle date future
 *
 * Ogni esecuzione è una funzione pura di (righe, operazioni, unità, data di esecuzione):
 * nessuno stato condiviso tra esecuzioni.
 */
@Service
public class SamplingAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(SamplingAnalysisService.class);

    private final OperationFilters operationFilters;
    private final RecordNormalizer normalizer;
    private final YearlyTallyBuilder tallyBuilder;
    private final FrequencyRecommender recommender;
    private final FutureDateProjector projector;
    private final Clock clock;

    public SamplingAnalysisService(OperationFilters operationFilters,
                                   RecordNormalizer normalizer,
                                   YearlyTallyBuilder tallyBuilder,
                                   FrequencyRecommender recommender,
                                   FutureDateProjector projector,
                                   Clock clock) {
        this.operationFilters = operationFilters;
        this.normalizer = normalizer;
        this.tallyBuilder = tallyBuilder;
        this.recommender = recommender;
        this.projector = projector;
        this.clock = clock;
    }

    /**
     * @return Data odierna secondo il Clock configurato
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Esegue l'analisi con la data odierna come data di esecuzione.
     */
    public AnalysisReport analyze(List<RawSampleRow> rows, Collection<String> operations, FrequencyUnit unit) {
        return analyze(rows, operations, unit, today());
    }

    /**
     * Esegue l'analisi completa.
     *
     * @param rows Righe grezze del file
     * @param operations Operazioni selezionate (vuota = tutte)
     * @param unit Unità della frequenza raccomandata
     * @param runDate Data di esecuzione (null = oggi)
     * @return Report con una riga per equipaggiamento e il calendario delle date future
     */
    public AnalysisReport analyze(List<RawSampleRow> rows,
                                  Collection<String> operations,
                                  FrequencyUnit unit,
                                  LocalDate runDate) {
        LocalDate effectiveRunDate = runDate != null ? runDate : today();
        List<String> selection = operationFilters.cleanSelection(operations);

        // ===== STEP 1: FILTRO PER OPERAZIONE =====
        List<RawSampleRow> selected = rows == null ? List.of() : rows.stream()
                .filter(operationFilters.predicate(selection))
                .collect(Collectors.toList());

        // ===== STEP 2: NORMALIZZAZIONE =====
        NormalizationResult normalized = normalizer.normalize(selected);

        // ===== STEP 3: CONTEGGIO ANNUALE =====
        List<Integer> years = tallyBuilder.yearsFor(effectiveRunDate);
        List<TallyRow> tally = tallyBuilder.tally(normalized.samples(), years);

        // ===== STEP 4: RACCOMANDAZIONE =====
        List<RecommendationRow> recommendations = recommender.recommend(normalized.samples(), unit);

        // ===== STEP 5: LEFT JOIN =====
        Map<EquipmentKey, RecommendationRow> recByKey = recommendations.stream()
                .collect(Collectors.toMap(RecommendationRow::key, Function.identity()));
        List<ReportRow> report = new ArrayList<>(tally.size());
        for (TallyRow t : tally) {
            report.add(ReportRow.join(t, recByKey.get(t.key())));
        }

        // ===== STEP 6: PROIEZIONE =====
        Map<EquipmentKey, LocalDate> lastDates = new HashMap<>();
        for (RecommendationRow r : recommendations) {
            lastDates.put(r.key(), r.lastSampleDate());
        }
        List<ProjectionRow> projections = projector.project(recommendations, lastDates, effectiveRunDate);

        long withRecommendation = recommendations.stream().filter(RecommendationRow::hasRecommendation).count();
        logger.info("Analisi del {}: {} righe selezionate, {} scartate, {} equipaggiamenti ({} con raccomandazione), {} date future",
                effectiveRunDate, selected.size(), normalized.droppedRows(), report.size(),
                withRecommendation, projections.size());

        return new AnalysisReport(
                effectiveRunDate,
                projector.horizonFor(effectiveRunDate),
                years,
                unit,
                selection,
                selected.size(),
                normalized.droppedRows(),
                normalized.samples().size(),
                report,
                projections
        );
    }
}
