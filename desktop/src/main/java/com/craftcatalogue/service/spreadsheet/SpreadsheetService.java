package com.craftcatalogue.service.spreadsheet;

import com.craftcatalogue.config.CatalogueSettings;
import com.craftcatalogue.dto.mapper.ComponentMapper;
import com.craftcatalogue.dto.request.ComponentRequest;
import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.dto.response.SpreadsheetImportResult;
import com.craftcatalogue.dto.response.SpreadsheetValidationDto;
import com.craftcatalogue.exception.CatalogueFileException;
import com.craftcatalogue.model.enums.CatalogueField;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Spreadsheet Import/Export Service
 *
 * Maps spreadsheet rows to component requests and component DTOs back to
 * rows. Import reads the first sheet of an .xlsx or .xls workbook and matches
 * header names case-insensitively; export always writes .xlsx in
 * {@link CatalogueField} order.
 */
@Service
@Slf4j
public class SpreadsheetService {

    public static final String SHEET_NAME = "Components";

    private static final int MAX_COLUMN_WIDTH = 50;
    private static final BigDecimal MAX_QUANTITY = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final CatalogueSettings settings;
    private final ComponentMapper componentMapper;
    private final Validator validator;

    public SpreadsheetService(CatalogueSettings settings, ComponentMapper componentMapper, Validator validator) {
        this.settings = settings;
        this.componentMapper = componentMapper;
        this.validator = validator;
    }

    // ========================================================================
    // Import
    // ========================================================================

    /**
     * Parse all rows of a spreadsheet.
     * Rows without a name, with a quantity or cost out of range, or with text
     * longer than its column allows are skipped and counted.
     *
     * @throws CatalogueFileException if the file is missing, unreadable or has no Name column
     */
    public SpreadsheetImportResult importFrom(Path file) {
        requireReadable(file);

        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            Sheet sheet = firstSheet(workbook, file);
            CellReader reader = new CellReader(workbook);

            Map<CatalogueField, Integer> columns = mapHeader(sheet.getRow(sheet.getFirstRowNum()), reader);
            if (!columns.containsKey(CatalogueField.NAME)) {
                throw new CatalogueFileException("Spreadsheet must contain a 'Name' column: " + file.getFileName());
            }

            List<ComponentRequest> components = new ArrayList<>();
            int skipped = 0;
            for (int i = sheet.getFirstRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (reader.isBlank(row)) {
                    continue;
                }
                Optional<ComponentRequest> parsed = parseRow(row, columns, reader);
                if (parsed.isPresent()) {
                    components.add(parsed.get());
                } else {
                    skipped++;
                }
            }

            log.info("Parsed {} rows from {} ({} skipped)", components.size(), file, skipped);
            return new SpreadsheetImportResult(List.copyOf(components), skipped);

        } catch (CatalogueFileException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new CatalogueFileException("Error reading spreadsheet " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Inspect a spreadsheet without importing it.
     * Never throws; problems are reported in the returned errors.
     */
    public SpreadsheetValidationDto validate(Path file) {
        try {
            requireReadable(file);
        } catch (CatalogueFileException e) {
            return new SpreadsheetValidationDto(false, 0, List.of(), false, List.of(e.getMessage()));
        }

        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            Sheet sheet = firstSheet(workbook, file);
            CellReader reader = new CellReader(workbook);

            Row header = sheet.getRow(sheet.getFirstRowNum());
            List<String> columns = new ArrayList<>();
            if (header != null) {
                for (Cell cell : header) {
                    String name = reader.text(cell);
                    if (!name.isEmpty()) {
                        columns.add(name);
                    }
                }
            }

            int rows = 0;
            for (int i = sheet.getFirstRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                if (!reader.isBlank(sheet.getRow(i))) {
                    rows++;
                }
            }

            boolean hasName = columns.stream().anyMatch(CatalogueField.NAME::matches);
            List<String> errors = hasName ? List.of() : List.of("Missing required 'Name' column");
            return new SpreadsheetValidationDto(hasName, rows, List.copyOf(columns), hasName, errors);

        } catch (IOException | RuntimeException e) {
            return new SpreadsheetValidationDto(false, 0, List.of(), false,
                List.of("Error reading file: " + e.getMessage()));
        }
    }

    // ========================================================================
    // Export
    // ========================================================================

    /**
     * Write components to an .xlsx file, replacing any existing file.
     *
     * @return the written file
     * @throws CatalogueFileException if the file cannot be written
     */
    public Path exportTo(List<ComponentDto> components, Path file) {
        CatalogueField[] fields = CatalogueField.values();

        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            CellStyle headerStyle = headerStyle(workbook);
            CellStyle costStyle = workbook.createCellStyle();
            costStyle.setDataFormat(workbook.createDataFormat().getFormat("0.00"));

            int[] widths = new int[fields.length];

            Row header = sheet.createRow(0);
            for (int i = 0; i < fields.length; i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(fields[i].getHeader());
                cell.setCellStyle(headerStyle);
                widths[i] = fields[i].getHeader().length();
            }

            int rowIndex = 1;
            for (ComponentDto component : components) {
                Row row = sheet.createRow(rowIndex++);
                for (int i = 0; i < fields.length; i++) {
                    Cell cell = row.createCell(i);
                    String shown = writeCell(cell, fields[i], component, costStyle);
                    widths[i] = Math.max(widths[i], shown.length());
                }
            }

            for (int i = 0; i < fields.length; i++) {
                sheet.setColumnWidth(i, Math.min(widths[i] + 2, MAX_COLUMN_WIDTH) * 256);
            }

            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }

            log.info("Exported {} components to {}", components.size(), file);
            return file;

        } catch (IOException e) {
            throw new CatalogueFileException("Error writing spreadsheet " + file + ": " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private void requireReadable(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new CatalogueFileException("File not found: " + file);
        }
        if (!Files.isReadable(file)) {
            throw new CatalogueFileException("File is not readable: " + file);
        }
    }

    private Sheet firstSheet(Workbook workbook, Path file) {
        if (workbook.getNumberOfSheets() == 0) {
            throw new CatalogueFileException("Spreadsheet has no sheets: " + file.getFileName());
        }
        Sheet sheet = workbook.getSheetAt(0);
        if (sheet.getPhysicalNumberOfRows() == 0) {
            throw new CatalogueFileException("Spreadsheet is empty: " + file.getFileName());
        }
        return sheet;
    }

    /**
     * Column index per known field; the first matching column wins.
     */
    private Map<CatalogueField, Integer> mapHeader(Row header, CellReader reader) {
        Map<CatalogueField, Integer> columns = new EnumMap<>(CatalogueField.class);
        if (header == null) {
            return columns;
        }
        for (Cell cell : header) {
            CatalogueField.fromHeader(reader.text(cell))
                .ifPresent(field -> columns.putIfAbsent(field, cell.getColumnIndex()));
        }
        return columns;
    }

    private Optional<ComponentRequest> parseRow(Row row, Map<CatalogueField, Integer> columns, CellReader reader) {
        String name = reader.text(row, columns.get(CatalogueField.NAME));
        if (name.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal quantity = reader.number(row, columns.get(CatalogueField.QUANTITY));
        BigDecimal cost = reader.number(row, columns.get(CatalogueField.COST_PER_UNIT));
        if (quantity.signum() < 0 || cost.signum() < 0 || quantity.compareTo(MAX_QUANTITY) > 0) {
            log.debug("Skipping row {}: quantity {} or cost {} out of range", row.getRowNum() + 1, quantity, cost);
            return Optional.empty();
        }

        String unit = reader.text(row, columns.get(CatalogueField.UNIT));

        ComponentRequest request = new ComponentRequest(
            name,
            reader.text(row, columns.get(CatalogueField.CATEGORY)),
            reader.text(row, columns.get(CatalogueField.DESCRIPTION)),
            quantity.intValue(),
            unit.isEmpty() ? settings.defaultUnit() : unit,
            componentMapper.normalizeCost(cost),
            reader.text(row, columns.get(CatalogueField.SUPPLIER)),
            reader.text(row, columns.get(CatalogueField.LOCATION)),
            reader.text(row, columns.get(CatalogueField.NOTES))
        );

        Set<ConstraintViolation<ComponentRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            log.debug("Skipping row {}: {}", row.getRowNum() + 1,
                violations.stream().map(ConstraintViolation::getMessage).sorted().toList());
            return Optional.empty();
        }
        return Optional.of(request);
    }

    /**
     * Write one field of a component into a cell and return its displayed text.
     */
    private String writeCell(Cell cell, CatalogueField field, ComponentDto component, CellStyle costStyle) {
        switch (field) {
            case QUANTITY -> {
                cell.setCellValue(component.quantity());
                return String.valueOf(component.quantity());
            }
            case COST_PER_UNIT -> {
                BigDecimal cost = componentMapper.normalizeCost(component.costPerUnit());
                cell.setCellValue(cost.doubleValue());
                cell.setCellStyle(costStyle);
                return cost.toPlainString();
            }
            default -> {
                String value = textOf(field, component);
                cell.setCellValue(value);
                return value;
            }
        }
    }

    private String textOf(CatalogueField field, ComponentDto component) {
        String value = switch (field) {
            case NAME -> component.name();
            case CATEGORY -> component.category();
            case DESCRIPTION -> component.description();
            case UNIT -> component.unit();
            case SUPPLIER -> component.supplier();
            case LOCATION -> component.location();
            case NOTES -> component.notes();
            default -> throw new IllegalArgumentException("Not a text field: " + field);
        };
        return value == null ? "" : value;
    }

    private CellStyle headerStyle(Workbook workbook) {
        Font font = workbook.createFont();
        font.setBold(true);

        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return style;
    }

    /**
     * Reads cell contents as trimmed text or as numbers, evaluating formulas.
     */
    private static final class CellReader {

        private final DataFormatter formatter = new DataFormatter();
        private final FormulaEvaluator evaluator;

        CellReader(Workbook workbook) {
            this.evaluator = workbook.getCreationHelper().createFormulaEvaluator();
        }

        String text(Cell cell) {
            if (cell == null) {
                return "";
            }
            return formatter.formatCellValue(cell, evaluator).trim();
        }

        String text(Row row, Integer column) {
            if (column == null) {
                return "";
            }
            return text(row.getCell(column, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
        }

        /**
         * Numeric value of a cell; empty or non-numeric content reads as zero.
         */
        BigDecimal number(Row row, Integer column) {
            if (column == null) {
                return BigDecimal.ZERO;
            }
            Cell cell = row.getCell(column, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            if (cell == null) {
                return BigDecimal.ZERO;
            }
            CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
            if (type == CellType.NUMERIC) {
                return BigDecimal.valueOf(cell.getNumericCellValue());
            }
            String value = text(cell).replace(",", "").replace("$", "");
            try {
                return new BigDecimal(value);
            } catch (NumberFormatException e) {
                return BigDecimal.ZERO;
            }
        }

        boolean isBlank(Row row) {
            if (row == null) {
                return true;
            }
            for (Cell cell : row) {
                if (!text(cell).isEmpty()) {
                    return false;
                }
            }
            return true;
        }
    }
}
