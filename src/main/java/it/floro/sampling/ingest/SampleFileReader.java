package it.floro.sampling.ingest;

import it.floro.sampling.domain.RawSampleRow;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lettura del file MobilServ caricato dall'utente (CSV o XLSX) in righe grezze.
 *
 * Vengono lette solo le sei colonne obbligatorie; le altre sono ignorate.
 * La data resta non tipizzata: per il CSV è la stringa della cella, per l'XLSX
 * è un LocalDateTime quando la cella è formattata come data.
 */
@Component
public class SampleFileReader {

    private static final Logger logger = LoggerFactory.getLogger(SampleFileReader.class);

    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    /**
     * Legge un file caricato scegliendo il formato dall'estensione.
     *
     * @param filename Nome originale del file (.csv, .xlsx, .xls)
     * @param in Contenuto del file
     * @return Righe grezze nell'ordine del file
     * @throws SampleFileException se il formato non è supportato o il contenuto non è valido
     */
    public List<RawSampleRow> read(String filename, InputStream in) {
        String name = filename == null ? "" : filename.trim().toLowerCase(Locale.ROOT);
        try {
            List<RawSampleRow> rows;
            if (name.endsWith(".csv")) {
                rows = readCsv(in);
            } else if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
                rows = readWorkbook(in);
            } else {
                throw new SampleFileException("Formato non supportato: caricare un file .csv o .xlsx");
            }
            logger.info("File '{}' letto: {} righe", filename, rows.size());
            return rows;
        } catch (IOException ex) {
            throw new SampleFileException("Impossibile leggere il file '" + filename + "': " + ex.getMessage(), ex);
        }
    }

    // ========================================================================
    // CSV
    // ========================================================================

    /**
     * Legge un CSV UTF-8 con intestazione. Separatore ',' oppure ';' (dedotto dall'intestazione),
     * campi tra doppi apici con "" come apice letterale, BOM iniziale opzionale.
     */
    List<RawSampleRow> readCsv(InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), 64 * 1024);

        String header = reader.readLine();
        if (header == null || header.isBlank()) {
            throw new SampleFileException("Il file è vuoto");
        }
        if (header.charAt(0) == BOM) {
            header = header.substring(1);
        }
        char delimiter = detectDelimiter(header);
        Map<String, Integer> columns = resolveColumns(parseCsvRecord(header, reader, delimiter));

        List<RawSampleRow> rows = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) continue;
            List<String> cells = parseCsvRecord(line, reader, delimiter);
            rows.add(new RawSampleRow(
                    cell(cells, columns, RawSampleRow.COL_UNIT_ID),
                    cell(cells, columns, RawSampleRow.COL_ASSET_ID),
                    cell(cells, columns, RawSampleRow.COL_ACCOUNT_NAME),
                    cell(cells, columns, RawSampleRow.COL_SAMPLE_BOTTLE_ID),
                    cell(cells, columns, RawSampleRow.COL_DATE_SAMPLED),
                    cell(cells, columns, RawSampleRow.COL_ASSET_CLASS)
            ));
        }
        return rows;
    }

    private static char detectDelimiter(String header) {
        return header.indexOf(';') >= 0 && header.indexOf(',') < 0 ? ';' : ',';
    }

    /**
     * Divide un record CSV in celle. Un campo tra apici può contenere separatori e a capo:
     * in quel caso il record prosegue sulle righe successive.
     */
    static List<String> parseCsvRecord(String firstLine, BufferedReader reader, char delimiter) throws IOException {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        String line = firstLine;

        while (true) {
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (inQuotes) {
                    if (c == QUOTE) {
                        if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                            current.append(QUOTE);
                            i++;
                        } else {
                            inQuotes = false;
                        }
                    } else {
                        current.append(c);
                    }
                } else if (c == QUOTE) {
                    inQuotes = true;
                } else if (c == delimiter) {
                    cells.add(current.toString());
                    current.setLength(0);
                } else {
                    current.append(c);
                }
            }
            if (!inQuotes) break;

            // Campo tra apici che continua sulla riga successiva
            String next = reader == null ? null : reader.readLine();
            if (next == null) {
                throw new SampleFileException("CSV non valido: apici non chiusi");
            }
            current.append('\n');
            line = next;
        }
        cells.add(current.toString());
        return cells;
    }

    // ========================================================================
    // XLSX
    // ========================================================================

    /**
     * Legge il primo foglio di una cartella Excel; la riga 0 è l'intestazione.
     */
    List<RawSampleRow> readWorkbook(InputStream in) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new SampleFileException("Il file è vuoto");
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new SampleFileException("Il file è vuoto");
            }

            DataFormatter formatter = new DataFormatter(Locale.US);
            List<String> headers = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                headers.add(formatter.formatCellValue(headerRow.getCell(c)));
            }
            Map<String, Integer> columns = resolveColumns(headers);

            List<RawSampleRow> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null || isBlankRow(row, formatter)) continue;
                rows.add(new RawSampleRow(
                        text(row, columns.get(RawSampleRow.COL_UNIT_ID), formatter),
                        text(row, columns.get(RawSampleRow.COL_ASSET_ID), formatter),
                        text(row, columns.get(RawSampleRow.COL_ACCOUNT_NAME), formatter),
                        text(row, columns.get(RawSampleRow.COL_SAMPLE_BOTTLE_ID), formatter),
                        dateValue(row, columns.get(RawSampleRow.COL_DATE_SAMPLED), formatter),
                        text(row, columns.get(RawSampleRow.COL_ASSET_CLASS), formatter)
                ));
            }
            return rows;
        } catch (SampleFileException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            // POI segnala i file corrotti con eccezioni unchecked
            throw new SampleFileException("File Excel non valido: " + ex.getMessage(), ex);
        }
    }

    private static boolean isBlankRow(Row row, DataFormatter formatter) {
        for (Cell cell : row) {
            if (!formatter.formatCellValue(cell).isBlank()) return false;
        }
        return true;
    }

    private static String text(Row row, int col, DataFormatter formatter) {
        Cell cell = row.getCell(col);
        if (cell == null) return null;
        String value = formatter.formatCellValue(cell);
        return value.isEmpty() ? null : value;
    }

    /**
     * Valore della data: LocalDateTime per le celle numeriche in formato data, testo
     * per tutte le altre. Un numero senza formato data (es. 20240115) resta testo e
     * viene interpretato, o scartato, dal parser delle date.
     */
    private static Object dateValue(Row row, int col, DataFormatter formatter) {
        Cell cell = row.getCell(col);
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC) {
            if (DateUtil.isCellDateFormatted(cell)) {
                return DateUtil.getLocalDateTime(cell.getNumericCellValue());
            }
        }
        String value = formatter.formatCellValue(cell);
        return value.isEmpty() ? null : value;
    }

    // ========================================================================
    // INTESTAZIONI
    // ========================================================================

    /**
     * Associa ogni colonna obbligatoria al suo indice. Il confronto ignora
     * maiuscole e spazi ai bordi.
     *
     * @throws SampleFileException se manca almeno una colonna obbligatoria
     */
    static Map<String, Integer> resolveColumns(List<String> headers) {
        Map<String, Integer> byName = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String h = headers.get(i);
            if (h != null) {
                byName.putIfAbsent(h.trim().toLowerCase(Locale.ROOT), i);
            }
        }

        Map<String, Integer> columns = new HashMap<>();
        List<String> missing = new ArrayList<>();
        for (String required : RawSampleRow.REQUIRED_COLUMNS) {
            Integer idx = byName.get(required.toLowerCase(Locale.ROOT));
            if (idx == null) {
                missing.add(required);
            } else {
                columns.put(required, idx);
            }
        }
        if (!missing.isEmpty()) {
            throw new SampleFileException("Colonne obbligatorie mancanti: " + String.join(", ", missing));
        }
        return columns;
    }

    private static String cell(List<String> cells, Map<String, Integer> columns, String column) {
        int idx = columns.get(column);
        if (idx >= cells.size()) return null;
        String value = cells.get(idx).trim();
        return value.isEmpty() ? null : value;
    }
}
