package com.liftlog.plugins.xlsx;

import com.liftlog.core.model.Cell;
import com.liftlog.core.model.CellStyle;
import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import com.liftlog.core.model.TimelineSheet;
import org.apache.poi.ss.usermodel.Comment;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lee la hoja "时间线"/"Timeline" de un .xlsx y produce el modelo de filas: valores,
 * colores ({@code #RRGGBB}) y comentarios por celda.
 */
public class TimelineWorkbookReader {
    private static final Logger log = LoggerFactory.getLogger(TimelineWorkbookReader.class);

    private static final Set<String> IGNORED_BACKGROUNDS = Set.of("#000000", "#FFFFFF");
    private static final Set<String> IGNORED_FONT_COLORS = Set.of("#000000");

    private final DataFormatter fmt = new DataFormatter();

    public TimelineSheet read(InputStream xlsx) {
        try (Workbook workbook = WorkbookFactory.create(xlsx)) {
            Sheet sheet = pickTimelineSheet(workbook);
            int headerRowIndex = sheet.getFirstRowNum();
            SheetHeaders headers = readHeaders(sheet.getRow(headerRowIndex));

            List<Row> rows = new ArrayList<>();
            for (int r = headerRowIndex + 1; r <= sheet.getLastRowNum(); r++) {
                org.apache.poi.ss.usermodel.Row poiRow = sheet.getRow(r);
                if (poiRow == null) continue;
                Row row = readRow(workbook, poiRow, headers, r - headerRowIndex);
                if (row != null) rows.add(row);
            }
            log.debug("read sheet '{}': {} headers, {} rows", sheet.getSheetName(), headers.size(), rows.size());
            return new TimelineSheet(sheet.getSheetName(), headers, rows);
        } catch (IOException | RuntimeException e) {
            throw new WorkbookReadException("Unable to read timeline workbook: " + e.getMessage(), e);
        }
    }

    static Sheet pickTimelineSheet(Workbook workbook) {
        if (workbook.getNumberOfSheets() == 0) {
            throw new IllegalStateException("workbook has no sheets");
        }
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            String name = workbook.getSheetName(i);
            if (name.contains("时间线") || name.contains("Timeline")) return workbook.getSheetAt(i);
        }
        return workbook.getSheetAt(0);
    }

    private SheetHeaders readHeaders(org.apache.poi.ss.usermodel.Row headerRow) {
        List<String> names = new ArrayList<>();
        if (headerRow != null) {
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                org.apache.poi.ss.usermodel.Cell cell = headerRow.getCell(c);
                names.add(cell == null ? "" : fmt.formatCellValue(cell).trim());
            }
        }
        return new SheetHeaders(names);
    }

    /**
     * Fila del modelo, o null si ninguna columna física tiene valor. Con cabeceras repetidas
     * gana la primera columna; las siguientes solo cuentan para decidir si la fila está vacía.
     */
    private Row readRow(Workbook workbook, org.apache.poi.ss.usermodel.Row poiRow, SheetHeaders headers, int id) {
        Map<String, Cell> cells = new LinkedHashMap<>();
        boolean anyValue = false;
        for (int c = 0; c < headers.size(); c++) {
            org.apache.poi.ss.usermodel.Cell poiCell = poiRow.getCell(c);
            Cell cell = poiCell == null ? Cell.empty() : readCell(workbook, poiCell);
            anyValue |= cell.hasValue();
            cells.putIfAbsent(headers.names().get(c), cell);
        }
        return anyValue ? Row.builder().id(id).cells(cells).build() : null;
    }

    private Cell readCell(Workbook workbook, org.apache.poi.ss.usermodel.Cell cell) {
        Object value = readValue(cell, cell.getCellType());
        Comment comment = cell.getCellComment();
        String commentText = comment == null || comment.getString() == null ? null : comment.getString().getString();
        return new Cell(value, readStyle(workbook, cell), commentText);
    }

    static Object readValue(org.apache.poi.ss.usermodel.Cell cell, CellType type) {
        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(cell)) yield cell.getLocalDateTimeCellValue();
                double d = cell.getNumericCellValue();
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < Long.MAX_VALUE) yield (long) d;
                yield d;
            }
            case BOOLEAN -> cell.getBooleanCellValue();
            case FORMULA -> readValue(cell, cell.getCachedFormulaResultType());
            default -> null;
        };
    }

    private static CellStyle readStyle(Workbook workbook, org.apache.poi.ss.usermodel.Cell cell) {
        org.apache.poi.ss.usermodel.CellStyle style = cell.getCellStyle();
        if (style == null) return CellStyle.EMPTY;

        String background = null;
        if (style.getFillForegroundColorColor() instanceof XSSFColor fill) {
            background = toRgb(fill);
            if (background != null && IGNORED_BACKGROUNDS.contains(background)) background = null;
        }

        String fontColor = null;
        Font font = workbook.getFontAt(style.getFontIndex());
        if (font instanceof XSSFFont xf && xf.getXSSFColor() != null) {
            fontColor = toRgb(xf.getXSSFColor());
            if (fontColor != null && IGNORED_FONT_COLORS.contains(fontColor)) fontColor = null;
        }
        return CellStyle.of(background, fontColor);
    }

    /** ARGB ("FF9966CC") o RGB → "#9966CC"; null para colores de tema sin RGB. */
    static String toRgb(XSSFColor color) {
        String hex = color.getARGBHex();
        if (hex == null) return null;
        hex = hex.toUpperCase();
        if (hex.length() == 8) return "#" + hex.substring(2);
        if (hex.length() == 6) return "#" + hex;
        return null;
    }
}
