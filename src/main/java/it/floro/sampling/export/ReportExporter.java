package it.floro.sampling.export;

import it.floro.sampling.domain.AnalysisReport;
import it.floro.sampling.domain.ProjectionRow;
import it.floro.sampling.domain.ReportRow;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Serializzazione del report di analisi per il download.
 *
 * Formati:
 * - XLSX: foglio "Recommended Sampling" (report) e foglio "Future Sampling Dates" (proiezione)
 * - CSV compatibile Excel: separatore ';', decimali con virgola, BOM UTF-8
 *
 * I valori mancanti (raccomandazione non definita) restano celle vuote, mai zero.
 */
@Component
public class ReportExporter {

    public static final String REPORT_SHEET = "Recommended Sampling";
    public static final String PROJECTION_SHEET = "Future Sampling Dates";

    public static final String XLSX_MEDIA_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private static final char DELIMITER = ';';
    private static final String NEWLINE = "\n";
    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final byte[] BOM = new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    // ========================================================================
    // INTESTAZIONI
    // ========================================================================

    /**
     * Intestazione del report: identità, un anno per colonna, raccomandazione e analitica ausiliaria.
     */
    public List<String> reportHeaders(AnalysisReport report) {
        List<String> headers = new ArrayList<>(List.of("Unit ID", "Asset ID", "Asset Class", "Account Name"));
        for (Integer y : report.years()) {
            headers.add(String.valueOf(y));
        }
        headers.add("Median Interval (Days)");
        headers.add("Recommended Frequency (" + report.unit().label() + ")");
        headers.add("Mean Interval (Days)");
        headers.add("Interval Z-Score (Asset Class)");
        headers.add("Recommendation");
        return headers;
    }

    public List<String> projectionHeaders() {
        return List.of("Unit ID", "Asset ID", "Asset Class", "Account Name", "Future Sample Date");
    }

    // ========================================================================
    // XLSX
    // ========================================================================

    /**
     * Genera la cartella Excel con report e proiezione.
     *
     * @param report Risultato dell'analisi
     * @return Contenuto del file .xlsx
     */
    public byte[] toXlsx(AnalysisReport report) {
        try (Workbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            CellStyle headerStyle = headerStyle(wb);
            CreationHelper helper = wb.getCreationHelper();
            CellStyle dateStyle = wb.createCellStyle();
            dateStyle.setDataFormat(helper.createDataFormat().getFormat("yyyy-mm-dd"));
            CellStyle oneDecimal = wb.createCellStyle();
            oneDecimal.setDataFormat(helper.createDataFormat().getFormat("0.0"));

            // ===== FOGLIO 1: REPORT =====
            Sheet sheet = wb.createSheet(REPORT_SHEET);
            writeHeader(sheet, reportHeaders(report), headerStyle);
            int r = 1;
            for (ReportRow row : report.rows()) {
                Row xr = sheet.createRow(r++);
                int c = 0;
                setText(xr, c++, row.key().unitId());
                setText(xr, c++, row.key().assetId());
                setText(xr, c++, row.assetClass());
                setText(xr, c++, row.accountName());
                for (Integer y : report.years()) {
                    xr.createCell(c++).setCellValue(row.samplesByYear().getOrDefault(y, 0));
                }
                setNumber(xr, c++, row.medianIntervalDays(), null);
                setNumber(xr, c++, row.recommendedFrequency(), oneDecimal);
                setNumber(xr, c++, row.meanIntervalDays(), null);
                setNumber(xr, c++, row.zScore(), null);
                setText(xr, c, row.recommendation());
            }
            sheet.createFreezePane(0, 1);

            // ===== FOGLIO 2: PROIEZIONE =====
            Sheet projections = wb.createSheet(PROJECTION_SHEET);
            writeHeader(projections, projectionHeaders(), headerStyle);
            r = 1;
            for (ProjectionRow p : report.projections()) {
                Row xr = projections.createRow(r++);
                setText(xr, 0, p.key().unitId());
                setText(xr, 1, p.key().assetId());
                setText(xr, 2, p.assetClass());
                setText(xr, 3, p.accountName());
                Cell dateCell = xr.createCell(4);
                dateCell.setCellValue(p.date());
                dateCell.setCellStyle(dateStyle);
            }
            projections.createFreezePane(0, 1);

            wb.write(out);
            return out.toByteArray();
        } catch (IOException ex) {
            throw new UncheckedIOException("Errore nella generazione del file Excel", ex);
        }
    }

    private static CellStyle headerStyle(Workbook wb) {
        Font bold = wb.createFont();
        bold.setBold(true);
        CellStyle style = wb.createCellStyle();
        style.setFont(bold);
        return style;
    }

    private static void writeHeader(Sheet sheet, List<String> headers, CellStyle style) {
        Row row = sheet.createRow(0);
        for (int i = 0; i < headers.size(); i++) {
            Cell cell = row.createCell(i);
            cell.setCellValue(headers.get(i));
            cell.setCellStyle(style);
        }
    }

    private static void setText(Row row, int col, String value) {
        Cell cell = row.createCell(col);
        if (value != null) {
            cell.setCellValue(value);
        }
    }

    private static void setNumber(Row row, int col, Double value, CellStyle style) {
        Cell cell = row.createCell(col);
        if (value != null) {
            cell.setCellValue(value);
            if (style != null) {
                cell.setCellStyle(style);
            }
        }
    }

    // ========================================================================
    // CSV
    // ========================================================================

    /**
     * CSV del report (una riga per equipaggiamento).
     */
    public byte[] reportCsv(AnalysisReport report) {
        StringBuilder sb = new StringBuilder(256 + report.rows().size() * 128);
        sb.append(String.join(String.valueOf(DELIMITER), reportHeaders(report))).append(NEWLINE);

        for (ReportRow row : report.rows()) {
            sb.append(safe(row.key().unitId()))
                    .append(DELIMITER).append(safe(row.key().assetId()))
                    .append(DELIMITER).append(safe(row.assetClass()))
                    .append(DELIMITER).append(safe(row.accountName()));
            for (Integer y : report.years()) {
                sb.append(DELIMITER).append(row.samplesByYear().getOrDefault(y, 0));
            }
            sb.append(DELIMITER).append(numIt(row.medianIntervalDays(), 1))
                    .append(DELIMITER).append(numIt(row.recommendedFrequency(), 1))
                    .append(DELIMITER).append(numIt(row.meanIntervalDays(), 2))
                    .append(DELIMITER).append(numIt(row.zScore(), 2))
                    .append(DELIMITER).append(safe(row.recommendation()))
                    .append(NEWLINE);
        }
        return withBom(sb);
    }

    /**
     * CSV della proiezione (una riga per equipaggiamento e data futura).
     */
    public byte[] projectionCsv(AnalysisReport report) {
        StringBuilder sb = new StringBuilder(128 + report.projections().size() * 64);
        sb.append(String.join(String.valueOf(DELIMITER), projectionHeaders())).append(NEWLINE);

        for (ProjectionRow p : report.projections()) {
            sb.append(safe(p.key().unitId()))
                    .append(DELIMITER).append(safe(p.key().assetId()))
                    .append(DELIMITER).append(safe(p.assetClass()))
                    .append(DELIMITER).append(safe(p.accountName()))
                    .append(DELIMITER).append(nullSafeDate(p.date()))
                    .append(NEWLINE);
        }
        return withBom(sb);
    }

    // ===================== Helpers =====================

    private static byte[] withBom(StringBuilder sb) {
        byte[] csv = sb.toString().getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[BOM.length + csv.length];
        System.arraycopy(BOM, 0, bytes, 0, BOM.length);
        System.arraycopy(csv, 0, bytes, BOM.length, csv.length);
        return bytes;
    }

    private static String nullSafeDate(LocalDate d) {
        return d != null ? d.format(DATE_FMT) : "";
    }

    /**
     * Sanitizzazione per campi testuali:
     * - Rimuove doppi apici, CR/LF e il separatore ';'
     * - Mitiga CSV injection: se inizia con = + - @, prefissa apostrofo
     */
    static String safe(String s) {
        if (s == null || s.isEmpty()) return "";
        String cleaned = s.replace("\"", "")
                .replace("\r", " ")
                .replace("\n", " ")
                .replace(String.valueOf(DELIMITER), ",");
        char c = cleaned.charAt(0);
        if (c == '=' || c == '+' || c == '-' || c == '@') {
            cleaned = "'" + cleaned;
        }
        return cleaned;
    }

    /**
     * Formatta con i decimali richiesti, punto → virgola, senza grouping; vuoto se null.
     */
    static String numIt(Double v, int decimals) {
        if (v == null) return "";
        return String.format(Locale.ROOT, "%." + decimals + "f", v).replace('.', ',');
    }
}
