package it.floro.sampling.web.api;

import it.floro.sampling.config.SamplingProperties;
import it.floro.sampling.domain.AnalysisReport;
import it.floro.sampling.domain.FrequencyUnit;
import it.floro.sampling.domain.RawSampleRow;
import it.floro.sampling.export.ReportExporter;
import it.floro.sampling.ingest.SampleFileException;
import it.floro.sampling.ingest.SampleFileReader;
import it.floro.sampling.service.OperationFilters;
import it.floro.sampling.service.SamplingAnalysisService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.List;

import static org.springframework.format.annotation.DateTimeFormat.ISO;

/**
 * Controller REST che espone l'analisi della frequenza di campionamento.
 *
 * Ogni chiamata è autonoma: riceve il file MobilServ (multipart "file"), lo legge,
 * esegue l'analisi e restituisce il risultato. Nulla viene conservato tra le chiamate.
 *
 * Mapping base: /api/sampling
 *
 * Parametri comuni:
 * - file: CSV o XLSX con le colonne obbligatorie
 * - operations: operazioni (Account Name) da analizzare, ripetibile; assente = tutte
 * - unit: "weeks" o "months" (default da configurazione)
 * - runDate: data di esecuzione ISO (default: oggi)
 */
@RestController
@RequestMapping("/api/sampling")
public class SamplingAnalysisController {

    private final SampleFileReader fileReader;
    private final OperationFilters operationFilters;
    private final SamplingAnalysisService analysisService;
    private final ReportExporter exporter;
    private final SamplingProperties properties;

    public SamplingAnalysisController(SampleFileReader fileReader,
                                      OperationFilters operationFilters,
                                      SamplingAnalysisService analysisService,
                                      ReportExporter exporter,
                                      SamplingProperties properties) {
        this.fileReader = fileReader;
        this.operationFilters = operationFilters;
        this.analysisService = analysisService;
        this.exporter = exporter;
        this.properties = properties;
    }

    /**
     * Elenca le operazioni presenti nel file, per popolare la selezione.
     *
     * @param file File MobilServ
     * @return Operazioni ordinate alfabeticamente
     */
    @PostMapping(value = "/operations", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public List<String> operations(@RequestPart("file") MultipartFile file) {
        return operationFilters.operationsFrom(readRows(file));
    }

    /**
     * Esegue l'analisi e restituisce il report in JSON.
     *
     * Esempio di risposta (estratto):
     * {
     *   "runDate": "2025-06-16",
     *   "years": [2021, 2022, 2023, 2024, 2025],
     *   "rows": [{"key": {"unitId": "U1", "assetId": "A1"}, "samplesByYear": {"2024": 2, ...},
     *             "medianIntervalDays": 91.0, "recommendedFrequency": 3.0, ...}],
     *   "projections": [{"key": {...}, "date": "2025-09-15"}, ...]
     * }
     */
    @PostMapping(value = "/analysis", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AnalysisReport analysis(
            @RequestPart("file") MultipartFile file,
            @RequestParam(required = false) List<String> operations,
            @RequestParam(required = false) String unit,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate runDate
    ) {
        return run(file, operations, unit, runDate);
    }

    /**
     * Esegue l'analisi e restituisce la cartella Excel.
     */
    @PostMapping(value = "/export/xlsx", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> exportXlsx(
            @RequestPart("file") MultipartFile file,
            @RequestParam(required = false) List<String> operations,
            @RequestParam(required = false) String unit,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate runDate
    ) {
        AnalysisReport report = run(file, operations, unit, runDate);
        return download(exporter.toXlsx(report), properties.export().fileName() + ".xlsx",
                MediaType.parseMediaType(ReportExporter.XLSX_MEDIA_TYPE));
    }

    /**
     * Esegue l'analisi e restituisce un CSV: "report" (default) oppure "projections".
     */
    @PostMapping(value = "/export/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> exportCsv(
            @RequestPart("file") MultipartFile file,
            @RequestParam(required = false) List<String> operations,
            @RequestParam(required = false) String unit,
            @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate runDate,
            @RequestParam(defaultValue = "report") String type
    ) {
        AnalysisReport report = run(file, operations, unit, runDate);
        String base = properties.export().fileName();
        return switch (type.trim().toLowerCase()) {
            case "report" -> download(exporter.reportCsv(report), base + ".csv", csvType());
            case "projections", "projection" -> download(exporter.projectionCsv(report), base + "_future_dates.csv", csvType());
            default -> throw new IllegalArgumentException("Tipo di CSV non valido: " + type);
        };
    }

    // ===================== Helpers =====================

    private AnalysisReport run(MultipartFile file, List<String> operations, String unit, LocalDate runDate) {
        FrequencyUnit frequencyUnit = FrequencyUnit.ofNullable(unit, properties.defaultUnit());
        return analysisService.analyze(readRows(file), operations, frequencyUnit, runDate);
    }

    private List<RawSampleRow> readRows(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new SampleFileException("Nessun file caricato");
        }
        try (InputStream in = file.getInputStream()) {
            return fileReader.read(file.getOriginalFilename(), in);
        } catch (IOException ex) {
            throw new SampleFileException("Impossibile leggere il file caricato", ex);
        }
    }

    private static MediaType csvType() {
        return MediaType.parseMediaType("text/csv; charset=UTF-8");
    }

    private static ResponseEntity<byte[]> download(byte[] bytes, String filename, MediaType type) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(type)
                .contentLength(bytes.length)
                .body(bytes);
    }
}
