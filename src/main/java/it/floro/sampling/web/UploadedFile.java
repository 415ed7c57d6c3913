package it.floro.sampling.web;

import it.floro.sampling.domain.RawSampleRow;

import java.util.List;

/**
 * File caricato nella sessione dell'interfaccia web: nome originale e righe lette.
 */
public record UploadedFile(String name, List<RawSampleRow> rows) {

    public UploadedFile {
        rows = List.copyOf(rows);
    }
}
