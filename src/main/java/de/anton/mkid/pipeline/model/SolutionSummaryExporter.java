package de.anton.mkid.pipeline.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a per-pixel summary of a calibration solution to an Excel file (.xlsx):
 * one sheet with the solution metadata and one row per pixel.
 */
public class SolutionSummaryExporter {

    private static final Logger logger = LoggerFactory.getLogger(SolutionSummaryExporter.class);

    static final String INFO_SHEET = "Solution";
    static final String PIXEL_SHEET = "Pixels";

    private static final List<String> COLUMNS_COMMON = List.of("Pixel", "Status", "Failure");
    private static final List<String> COLUMNS_WAVECAL = List.of("Min phase", "Max phase", "Reduced chi2", "Reference points");

    /** Summary file name for a solution. */
    public static String fileNameOf(CalibrationSolution solution) {
        return solution.getSolutionId() + ".xlsx";
    }

    /**
     * Exports the solution into {@code directory}.
     *
     * @return the written file
     */
    public Path export(CalibrationSolution solution, Path directory) throws IOException {
        Objects.requireNonNull(solution, "Solution cannot be null.");
        Objects.requireNonNull(directory, "Output directory cannot be null.");
        Files.createDirectories(directory);
        Path file = directory.resolve(fileNameOf(solution));

        logger.info("Starting summary export of {} to: {}", solution.getSolutionId(), file);
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            CellStyle headerStyle = headerStyle(workbook);
            writeInfoSheet(workbook.createSheet(INFO_SHEET), solution, headerStyle);
            Sheet pixels = workbook.createSheet(PIXEL_SHEET);
            if (solution instanceof WavelengthSolution) {
                writeWavecalPixels(pixels, (WavelengthSolution) solution, headerStyle);
            } else if (solution instanceof FlatSolution) {
                writeFlatPixels(pixels, (FlatSolution) solution, headerStyle);
            } else {
                throw new IllegalArgumentException("Unsupported solution type " + solution.getClass().getName());
            }
            workbook.write(out);
            logger.info("Summary export completed successfully to: {}", file);
            return file;
        } catch (IOException e) {
            logger.error("IOException during summary export to {}", file, e);
            throw e;
        }
    }

    private void writeInfoSheet(Sheet sheet, CalibrationSolution solution, CellStyle headerStyle) {
        Provenance provenance = solution.getProvenance();
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[] {"Solution id", solution.getSolutionId()});
        rows.add(new String[] {"Step", solution.getKind().stepName()});
        rows.add(new String[] {"Instrument", provenance.instrumentId()});
        rows.add(new String[] {"Dataset", provenance.dataset()});
        rows.add(new String[] {"Coverage", provenance.coverage().toString()});
        rows.add(new String[] {"Created (epoch ms)", String.valueOf(provenance.createdAtMillis())});
        rows.add(new String[] {"Usable pixels", solution.getUsablePixelCount() + " / " + solution.getPixelCount()});
        for (Map.Entry<String, Object> e : solution.getConfig().fingerprintFields().entrySet()) {
            rows.add(new String[] {"config." + e.getKey(), String.valueOf(e.getValue())});
        }
        int rowNum = 0;
        for (String[] values : rows) {
            Row row = sheet.createRow(rowNum++);
            Cell key = row.createCell(0);
            key.setCellValue(values[0]);
            key.setCellStyle(headerStyle);
            row.createCell(1).setCellValue(values[1]);
        }
        sheet.setColumnWidth(0, 28 * 256); // fixed widths, autosizing needs AWT fonts
        sheet.setColumnWidth(1, 64 * 256);
    }

    private void writeWavecalPixels(Sheet sheet, WavelengthSolution solution, CellStyle headerStyle) {
        int order = solution.getConfig().modelOrder();
        List<String> columns = new ArrayList<>(COLUMNS_COMMON);
        for (int i = 0; i <= order; i++) {
            columns.add("c" + i);
        }
        columns.addAll(COLUMNS_WAVECAL);
        double[] lines = solution.getReferenceWavelengthsNm();
        for (double line : lines) {
            columns.add(String.format("R %.0f nm", line));
        }
        writeHeader(sheet, columns, headerStyle);

        int rowNum = 1;
        for (WavecalPixel p : solution.getPixels()) {
            Row row = sheet.createRow(rowNum++);
            int cellNum = writeStatus(row, p.pixel(), p.status(), p.failure());
            double[] c = p.coefficients();
            for (int i = 0; i <= order; i++) {
                createNumericCell(row, cellNum++, i < c.length ? c[i] : Double.NaN);
            }
            createNumericCell(row, cellNum++, p.minPhase());
            createNumericCell(row, cellNum++, p.maxPhase());
            createNumericCell(row, cellNum++, p.reducedChiSquared());
            row.createCell(cellNum++).setCellValue(p.referencePoints());
            for (int line = 0; line < lines.length; line++) {
                createNumericCell(row, cellNum++, p.resolvingPower(line));
            }
        }
    }

    private void writeFlatPixels(Sheet sheet, FlatSolution solution, CellStyle headerStyle) {
        double[] edges = solution.getBinEdgesNm();
        List<String> columns = new ArrayList<>(COLUMNS_COMMON);
        columns.add("Count rate (1/s)");
        for (int b = 0; b < solution.getBinCount(); b++) {
            columns.add(String.format("%.0f-%.0f nm", edges[b], edges[b + 1]));
        }
        writeHeader(sheet, columns, headerStyle);

        int rowNum = 1;
        for (FlatPixel p : solution.getPixels()) {
            Row row = sheet.createRow(rowNum++);
            int cellNum = writeStatus(row, p.pixel(), p.status(), p.failure());
            createNumericCell(row, cellNum++, p.countRate());
            for (int b = 0; b < solution.getBinCount(); b++) {
                createNumericCell(row, cellNum++, p.weight(b));
            }
        }
    }

    private int writeStatus(Row row, int pixel, PixelStatus status, FitFailure failure) {
        row.createCell(0).setCellValue(pixel);
        row.createCell(1).setCellValue(status.name());
        row.createCell(2).setCellValue(failure == null ? "" : failure.description());
        return 3;
    }

    private void writeHeader(Sheet sheet, List<String> columns, CellStyle headerStyle) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < columns.size(); i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(columns.get(i));
            cell.setCellStyle(headerStyle);
        }
    }

    private CellStyle headerStyle(Workbook workbook) {
        Font headerFont = workbook.createFont();
        headerFont.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(headerFont);
        return style;
    }

    private void createNumericCell(Row row, int colIndex, double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value)) {
            row.createCell(colIndex).setCellValue(value);
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }
}
