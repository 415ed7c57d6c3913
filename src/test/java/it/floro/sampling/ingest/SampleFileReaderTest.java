package it.floro.sampling.ingest;

import it.floro.sampling.domain.RawSampleRow;
import it.floro.sampling.service.DateValueParser;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SampleFileReaderTest {

    private static final String HEADER = "Unit ID,Asset ID,Account Name,Sample Bottle ID,Date Sampled,Asset Class";

    private final SampleFileReader reader = new SampleFileReader();

    private static InputStream utf8(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testCsvWithQuotesAndExtraColumns() {
        String csv = "Lab,"  + HEADER + "\n"
                + "X,U1,A1,\"Mina Norte, Fase 2\",B1,2024-01-15,Engine\n"
                + "\n"
                + "X,U1,A1,\"Planta \"\"Sur\"\"\",B2,01/20/2024,Engine\n";

        List<RawSampleRow> rows = reader.read("samples.csv", utf8(csv));

        assertEquals(2, rows.size());
        assertEquals("Mina Norte, Fase 2", rows.get(0).accountName());
        assertEquals("2024-01-15", rows.get(0).dateSampled());
        assertEquals("Planta \"Sur\"", rows.get(1).accountName());
        assertEquals("B2", rows.get(1).sampleBottleId());
    }

    @Test
    void testCsvWithBomSemicolonAndCaseInsensitiveHeader() {
        String csv = "\uFEFFunit id;ASSET ID; Account Name ;Sample Bottle ID;Date Sampled;Asset Class\n"
                + "U1;A1;Op;B1;2024-01-15;Engine\n";

        List<RawSampleRow> rows = reader.read("EXPORT.CSV", utf8(csv));

        assertEquals(1, rows.size());
        assertEquals("U1", rows.get(0).unitId());
        assertEquals("Engine", rows.get(0).assetClass());
    }

    @Test
    void testCsvMultilineQuotedField() {
        String csv = HEADER + "\nU1,A1,\"Op\nNord\",B1,2024-01-15,Engine\nU2,A2,Op,B2,2024-02-15,Engine\n";

        List<RawSampleRow> rows = reader.read("s.csv", utf8(csv));

        assertEquals(2, rows.size());
        assertEquals("Op\nNord", rows.get(0).accountName());
        assertEquals("U2", rows.get(1).unitId());
    }

    @Test
    void testMissingColumnsAreReported() {
        String csv = "Unit ID,Asset ID,Account Name,Asset Class\nU1,A1,Op,Engine\n";

        SampleFileException ex = assertThrows(SampleFileException.class, () -> reader.read("s.csv", utf8(csv)));

        assertTrue(ex.getMessage().contains("Sample Bottle ID"));
        assertTrue(ex.getMessage().contains("Date Sampled"));
    }

    @Test
    void testInvalidInputs() {
        assertThrows(SampleFileException.class, () -> reader.read("s.csv", utf8("")));
        assertThrows(SampleFileException.class, () -> reader.read("s.txt", utf8(HEADER)));
        assertThrows(SampleFileException.class,
                () -> reader.read("s.csv", utf8(HEADER + "\nU1,A1,\"Op,B1,2024-01-15,Engine\n")));
        assertThrows(SampleFileException.class, () -> reader.read("s.xlsx", utf8("not a workbook")));
    }

    @Test
    void testWorkbookWithDateCellsAndNumericIds() throws IOException {
        byte[] xlsx;
        try (Workbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            CellStyle dateStyle = wb.createCellStyle();
            dateStyle.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat("m/d/yy"));

            Sheet sheet = wb.createSheet("Export");
            Row header = sheet.createRow(0);
            String[] names = {"Asset Class", "Unit ID", "Asset ID", "Account Name", "Sample Bottle ID", "Date Sampled"};
            for (int i = 0; i < names.length; i++) {
                header.createCell(i).setCellValue(names[i]);
            }

            Row r1 = sheet.createRow(1);
            r1.createCell(0).setCellValue("Engine");
            r1.createCell(1).setCellValue("U1");
            r1.createCell(2).setCellValue("A1");
            r1.createCell(3).setCellValue("Mina Norte");
            r1.createCell(4).setCellValue(12345);
            Cell date = r1.createCell(5);
            date.setCellValue(LocalDate.of(2024, 3, 5));
            date.setCellStyle(dateStyle);

            sheet.createRow(2);

            Row r3 = sheet.createRow(3);
            r3.createCell(1).setCellValue("U2");
            r3.createCell(5).setCellValue("2024-04-01");

            Row r4 = sheet.createRow(4);
            r4.createCell(1).setCellValue("U3");
            r4.createCell(5).setCellValue(20240115);

            wb.write(out);
            xlsx = out.toByteArray();
        }

        List<RawSampleRow> rows = reader.read("export.xlsx", new ByteArrayInputStream(xlsx));

        assertEquals(3, rows.size());
        assertEquals("12345", rows.get(0).sampleBottleId());
        assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0), rows.get(0).dateSampled());
        assertEquals("Engine", rows.get(0).assetClass());
        assertEquals("U2", rows.get(1).unitId());
        assertEquals("2024-04-01", rows.get(1).dateSampled());
        assertNull(rows.get(1).assetClass());
        assertEquals("20240115", rows.get(2).dateSampled());
        assertEquals(Optional.of(LocalDate.of(2024, 1, 15)),
                DateValueParser.parse(rows.get(2).dateSampled(), ZoneOffset.UTC));
    }
}
