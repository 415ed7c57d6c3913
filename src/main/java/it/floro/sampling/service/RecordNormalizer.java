package it.floro.sampling.service;

import it.floro.sampling.config.SamplingProperties;
import it.floro.sampling.domain.NormalizationResult;
import it.floro.sampling.domain.RawSampleRow;
import it.floro.sampling.domain.SampleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulizia delle righe grezze in campioni normalizzati.
 *
 * Regole:
 * - "Date Sampled" viene convertita con DateValueParser
 * - Le righe con data assente o non interpretabile vengono scartate e contate (mai errore fatale)
 * - Le righe senza Unit ID o Asset ID vengono scartate allo stesso modo: non identificano un equipaggiamento
 * - Gli identificatori vengono trimmati; stringhe vuote diventano null
 *
 * Se tutte le righe vengono scartate il risultato è vuoto e le fasi successive
 * producono conteggi e raccomandazioni vuoti.
 */
@Component
public class RecordNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);

    private final ZoneId zone;

    public RecordNormalizer(SamplingProperties properties) {
        this.zone = properties.zone();
    }

    /**
     * Normalizza le righe grezze.
     *
     * @param rawRows Righe lette dal file (null ammesso: trattato come lista vuota)
     * @return Campioni validi e numero di righe scartate
     */
    public NormalizationResult normalize(List<RawSampleRow> rawRows) {
        if (rawRows == null || rawRows.isEmpty()) {
            return NormalizationResult.empty();
        }

        List<SampleRecord> samples = new ArrayList<>(rawRows.size());
        int dropped = 0;
        int rowNumber = 0;

        for (RawSampleRow row : rawRows) {
            rowNumber++;
            if (row == null) {
                dropped++;
                continue;
            }

            String unitId = clean(row.unitId());
            String assetId = clean(row.assetId());
            if (unitId == null || assetId == null) {
                dropped++;
                logger.debug("Riga {} scartata: Unit ID o Asset ID mancante (unità '{}', asset '{}')",
                        rowNumber, row.unitId(), row.assetId());
                continue;
            }

            Optional<LocalDate> date = DateValueParser.parse(row.dateSampled(), zone);
            if (date.isEmpty()) {
                dropped++;
                logger.debug("Riga {} scartata: data di campionamento non valida '{}' (unità {}, asset {})",
                        rowNumber, row.dateSampled(), row.unitId(), row.assetId());
                continue;
            }

            samples.add(new SampleRecord(
                    unitId,
                    assetId,
                    clean(row.accountName()),
                    clean(row.sampleBottleId()),
                    date.get(),
                    clean(row.assetClass())
            ));
        }

        if (dropped > 0) {
            logger.info("Normalizzazione: {} righe valide, {} scartate per identificativo o data mancante/non valida",
                    samples.size(), dropped);
        }
        return new NormalizationResult(samples, dropped);
    }

    /**
     * Trim null-safe con conversione di stringhe vuote a null.
     */
    private static String clean(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
