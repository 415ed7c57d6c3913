package it.floro.sampling.domain;

import java.util.List;

/**
 * Esito della normalizzazione: campioni validi più il numero di righe scartate
 * per data mancante o non interpretabile.
 */
public record NormalizationResult(
        List<SampleRecord> samples,         // Campioni con data valida
        int droppedRows                     // Righe scartate (data assente o malformata)
) {

    public NormalizationResult {
        samples = List.copyOf(samples);
    }

    public static NormalizationResult empty() {
        return new NormalizationResult(List.of(), 0);
    }
}
