package it.floro.sampling.service;

import it.floro.sampling.domain.RawSampleRow;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Componente per la selezione delle operazioni (Account Name) su cui eseguire l'analisi.
 *
 * Responsabilità:
 * - Estrarre le operazioni disponibili nel file caricato (per la multiselezione in UI)
 * - Normalizzare la selezione (trim, blank → esclusi)
 * - Generare il Predicate che filtra le righe grezze per operazione
 *
 * Il confronto è case- e accent-insensitive. Una selezione vuota seleziona tutte le righe.
 */
@Component
public class OperationFilters {

    /**
     * Estrae le operazioni uniche presenti nel dataset.
     *
     * Proprietà:
     * - Ordinate alfabeticamente (case- e accent-insensitive)
     * - Deduplicate
     * - Null e stringhe vuote esclusi
     *
     * @param rows Righe grezze del file
     * @return Lista di operazioni ordinate
     */
    public List<String> operationsFrom(List<RawSampleRow> rows) {
        return rows.stream()
                .map(RawSampleRow::accountName)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .sorted(alphaInsensitive())
                .collect(Collectors.toList());
    }

    /**
     * Normalizza la selezione ricevuta dalla richiesta: trim, rimozione dei vuoti e dei duplicati.
     *
     * @param selected Operazioni selezionate (null ammesso)
     * @return Selezione pulita, nell'ordine alfabetico
     */
    public List<String> cleanSelection(Collection<String> selected) {
        if (selected == null) return List.of();
        return selected.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .sorted(alphaInsensitive())
                .collect(Collectors.toList());
    }

    /**
     * Genera un Predicate che accetta le righe delle operazioni selezionate.
     *
     * @param selected Operazioni selezionate; vuota = tutte
     * @return Predicate sulle righe grezze
     */
    public Predicate<RawSampleRow> predicate(Collection<String> selected) {
        final Set<String> wanted = cleanSelection(selected).stream()
                .map(OperationFilters::normalizeNullable)
                .collect(Collectors.toSet());

        return r -> {
            if (r == null) return false;
            if (wanted.isEmpty()) return true;
            String account = normalizeNullable(r.accountName());
            return account != null && wanted.contains(account);
        };
    }

    // ========= METODI UTILITY PRIVATI =========

    /**
     * Normalizza una stringa per confronti case- e accent-insensitive.
     *
     * Esempi:
     * - "MINERA NORTE" → "minera norte"
     * - "Operación Sur" → "operacion sur"
     * - "  Planta   3 " → "planta 3"
     *
     * @param s Stringa da normalizzare
     * @return Stringa normalizzata, o null se s è null
     */
    static String normalizeNullable(String s) {
        if (s == null) return null;
        return Normalizer.normalize(s, Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .toLowerCase()
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static Comparator<String> alphaInsensitive() {
        return Comparator.comparing((String s) -> normalizeNullable(Objects.toString(s, "")))
                .thenComparing(Comparator.naturalOrder());
    }
}
