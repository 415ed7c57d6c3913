package it.floro.sampling.web;

import it.floro.sampling.config.SamplingProperties;
import it.floro.sampling.domain.AnalysisReport;
import it.floro.sampling.domain.FrequencyUnit;
import it.floro.sampling.domain.RawSampleRow;
import it.floro.sampling.export.ReportExporter;
import it.floro.sampling.ingest.SampleFileException;
import it.floro.sampling.ingest.SampleFileReader;
import it.floro.sampling.service.OperationFilters;
import it.floro.sampling.service.SamplingAnalysisService;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Controller dell'interfaccia web interattiva (Thymeleaf).
 *
 * Flusso in tre passi:
 * 1. GET /          → form di caricamento del file MobilServ
 * 2. POST /upload   → lettura del file, righe conservate nella sessione HTTP, scelta delle operazioni
 * 3. POST /analyze  → analisi sulle operazioni scelte, view "report"
 * Infine GET /download scarica l'Excel dell'ultima analisi della sessione.
 *
 * Il dataset vive solo nella sessione corrente: nessuna persistenza.
 */
@Controller
public class SamplingController {

    private static final Logger logger = LoggerFactory.getLogger(SamplingController.class);

    static final String SESSION_UPLOAD = "sampling.upload";
    static final String SESSION_REPORT = "sampling.report";

    private final SampleFileReader fileReader;
    private final OperationFilters operationFilters;
    private final SamplingAnalysisService analysisService;
    private final ReportExporter exporter;
    private final SamplingProperties properties;

    public SamplingController(SampleFileReader fileReader,
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

    @GetMapping("/")
    public String index(HttpSession session, Model model) {
        populateUpload(session, model);
        return "index";
    }

    /**
     * Passo 1: legge il file e lo conserva nella sessione.
     */
    @PostMapping("/upload")
    public String upload(@RequestParam("file") MultipartFile file, HttpSession session, Model model) {
        if (file == null || file.isEmpty()) {
            model.addAttribute("errorMsg", "Carica prima un file CSV o XLSX.");
            populateUpload(session, model);
            return "index";
        }
        try (InputStream in = file.getInputStream()) {
            List<RawSampleRow> rows = fileReader.read(file.getOriginalFilename(), in);
            session.setAttribute(SESSION_UPLOAD, new UploadedFile(file.getOriginalFilename(), rows));
            session.removeAttribute(SESSION_REPORT);
        } catch (SampleFileException ex) {
            logger.warn("Caricamento rifiutato '{}': {}", file.getOriginalFilename(), ex.getMessage());
            model.addAttribute("errorMsg", ex.getMessage());
        } catch (IOException ex) {
            logger.warn("Caricamento non leggibile '{}': {}", file.getOriginalFilename(), ex.getMessage());
            model.addAttribute("errorMsg", "Impossibile leggere il file caricato.");
        }
        populateUpload(session, model);
        return "index";
    }

    /**
     * Passo 2: esegue l'analisi sulle operazioni selezionate.
     */
    @PostMapping("/analyze")
    public String analyze(@RequestParam(required = false) List<String> operations,
                          @RequestParam(required = false) String unit,
                          HttpSession session,
                          Model model) {
        UploadedFile upload = sessionUpload(session);
        if (upload == null) {
            model.addAttribute("errorMsg", "Carica prima il file.");
            populateUpload(session, model);
            return "index";
        }
        List<String> selection = operationFilters.cleanSelection(operations);
        if (selection.isEmpty()) {
            model.addAttribute("infoMsg", "Seleziona almeno un'operazione per continuare.");
            populateUpload(session, model);
            return "index";
        }

        FrequencyUnit frequencyUnit;
        try {
            frequencyUnit = FrequencyUnit.ofNullable(unit, properties.defaultUnit());
        } catch (IllegalArgumentException ex) {
            model.addAttribute("errorMsg", ex.getMessage());
            populateUpload(session, model);
            return "index";
        }

        AnalysisReport report = analysisService.analyze(upload.rows(), selection, frequencyUnit);
        session.setAttribute(SESSION_REPORT, report);

        model.addAttribute("report", report);
        model.addAttribute("fileName", upload.name());
        model.addAttribute("unitLabel", frequencyUnit.label());
        return "report";
    }

    /**
     * Scarica l'Excel dell'ultima analisi; senza analisi torna alla pagina iniziale.
     */
    @GetMapping("/download")
    public ResponseEntity<byte[]> download(HttpSession session) {
        Object report = session.getAttribute(SESSION_REPORT);
        if (!(report instanceof AnalysisReport analysisReport)) {
            return ResponseEntity.status(302).header(HttpHeaders.LOCATION, "/").build();
        }
        byte[] bytes = exporter.toXlsx(analysisReport);
        String filename = properties.export().fileName() + ".xlsx";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(MediaType.parseMediaType(ReportExporter.XLSX_MEDIA_TYPE))
                .contentLength(bytes.length)
                .body(bytes);
    }

    // ===================== Helpers =====================

    private void populateUpload(HttpSession session, Model model) {
        UploadedFile upload = sessionUpload(session);
        model.addAttribute("fileName", upload == null ? null : upload.name());
        model.addAttribute("rowCount", upload == null ? 0 : upload.rows().size());
        model.addAttribute("operations", upload == null ? List.of() : operationFilters.operationsFrom(upload.rows()));
        model.addAttribute("units", FrequencyUnit.values());
        model.addAttribute("defaultUnit", properties.defaultUnit());
    }

    private static UploadedFile sessionUpload(HttpSession session) {
        Object upload = session.getAttribute(SESSION_UPLOAD);
        return upload instanceof UploadedFile uploaded ? uploaded : null;
    }
}
