package com.craftcatalogue.service.spreadsheet;

import com.craftcatalogue.config.CatalogueSettings;
import com.craftcatalogue.dto.mapper.ComponentMapper;
import com.craftcatalogue.dto.request.ComponentRequest;
import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.dto.response.SpreadsheetImportResult;
import com.craftcatalogue.dto.response.SpreadsheetValidationDto;
import com.craftcatalogue.exception.CatalogueFileException;
import com.craftcatalogue.model.enums.CatalogueField;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpreadsheetService}.
 */
class SpreadsheetServiceTest {

    @TempDir
    Path tempDir;

    private ValidatorFactory validatorFactory;
    private SpreadsheetService service;

    @BeforeEach
    void setUp() {
        CatalogueSettings settings = CatalogueSettings.defaults();
        validatorFactory = Validation.buildDefaultValidatorFactory();
        service = new SpreadsheetService(settings, new ComponentMapper(settings), validatorFactory.getValidator());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    // ========================================================================
    // Import
    // ========================================================================

    @Test
    void importFrom_rowWithoutName_isSkippedAndCounted() throws IOException {
        Path file = workbook("parts.xlsx",
            new Object[] {"Name", "Quantity", "Category"},
            new Object[] {"Bolt", "10", null},
            new Object[] {null, null, "Hardware"});

        SpreadsheetImportResult result = service.importFrom(file);

        assertThat(result.skippedRows()).isEqualTo(1);
        assertThat(result.components()).singleElement().satisfies(component -> {
            assertThat(component.name()).isEqualTo("Bolt");
            assertThat(component.quantity()).isEqualTo(10);
        });
    }

    @Test
    void importFrom_missingOptionalColumns_usesDefaults() throws IOException {
        Path file = workbook("names.xlsx",
            new Object[] {"Name"},
            new Object[] {"Sequins"});

        SpreadsheetImportResult result = service.importFrom(file);

        assertThat(result.components()).containsExactly(new ComponentRequest(
            "Sequins", "", "", 0, "pieces", new BigDecimal("0.00"), "", "", ""));
        assertThat(result.skippedRows()).isZero();
    }

    @Test
    void importFrom_matchesHeadersCaseInsensitivelyAndByAlias() throws IOException {
        Path file = workbook("aliases.xlsx",
            new Object[] {"  COMPONENT NAME ", "qty", "Price", "Vendor", "Colour", "storage", "REMARKS"},
            new Object[] {"Felt sheet", 12.0, 1.5, "Craft Co", "Red", "Shelf A", "Soft"});

        SpreadsheetImportResult result = service.importFrom(file);

        assertThat(result.components()).containsExactly(new ComponentRequest(
            "Felt sheet", "", "", 12, "pieces", new BigDecimal("1.50"), "Craft Co", "Shelf A", "Soft"));
    }

    @Test
    void importFrom_nonNumericValues_readAsZero() throws IOException {
        Path file = workbook("numbers.xlsx",
            new Object[] {"Name", "Quantity", "Cost per Unit"},
            new Object[] {"Button", "lots", "n/a"},
            new Object[] {"Thread", "7.9", "$1,250.5"});

        SpreadsheetImportResult result = service.importFrom(file);

        assertThat(result.components()).extracting(ComponentRequest::quantity).containsExactly(0, 7);
        assertThat(result.components()).extracting(ComponentRequest::costPerUnit)
            .containsExactly(new BigDecimal("0.00"), new BigDecimal("1250.50"));
    }

    @Test
    void importFrom_negativeQuantityOrCost_isSkipped() throws IOException {
        Path file = workbook("negative.xlsx",
            new Object[] {"Name", "Quantity", "Cost per Unit"},
            new Object[] {"Bead", -3.0, 0.1},
            new Object[] {"Pin", 3.0, -0.1},
            new Object[] {"Clasp", 3.0, 0.1});

        SpreadsheetImportResult result = service.importFrom(file);

        assertThat(result.components()).extracting(ComponentRequest::name).containsExactly("Clasp");
        assertThat(result.skippedRows()).isEqualTo(2);
    }

    @Test
    void importFrom_quantityBeyondIntRange_isSkipped() throws IOException {
        Path file = workbook("huge.xlsx",
            new Object[] {"Name", "Quantity"},
            new Object[] {"Sand", 5.0e9},
            new Object[] {"Glitter", "3000000000"},
            new Object[] {"Thread", (double) Integer.MAX_VALUE});

        SpreadsheetImportResult result = service.importFrom(file);

        assertThat(result.components()).singleElement().satisfies(component -> {
            assertThat(component.name()).isEqualTo("Thread");
            assertThat(component.quantity()).isEqualTo(Integer.MAX_VALUE);
        });
        assertThat(result.skippedRows()).isEqualTo(2);
    }

    @Test
    void importFrom_valuesTooLargeForStorage_areSkipped() throws IOException {
        Path file = workbook("oversized.xlsx",
            new Object[] {"Name", "Notes", "Cost per Unit", "Category"},
            new Object[] {"Bolt", "fine", 1.0, "Hardware"},
            new Object[] {"Rope", "x".repeat(4500), 1.0, "Hardware"},
            new Object[] {"Gold leaf", "", 1.0e14, "Hardware"},
            new Object[] {"Wire", "", 1.0, "c".repeat(300)},
            new Object[] {"Nut", "", 999999999999.99, "Hardware"});

        SpreadsheetImportResult result = service.importFrom(file);

        assertThat(result.components()).extracting(ComponentRequest::name).containsExactly("Bolt", "Nut");
        assertThat(result.components().get(1).costPerUnit()).isEqualTo(new BigDecimal("999999999999.99"));
        assertThat(result.skippedRows()).isEqualTo(3);
    }

    @Test
    void importFrom_blankRows_areIgnoredWithoutCounting() throws IOException {
        Path file = workbook("gaps.xlsx",
            new Object[] {"Name", "Category"},
            new Object[] {"Bolt", "Hardware"},
            new Object[] {null, null},
            new Object[] {"  ", ""},
            new Object[] {"Nut", "Hardware"});

        SpreadsheetImportResult result = service.importFrom(file);

        assertThat(result.components()).extracting(ComponentRequest::name).containsExactly("Bolt", "Nut");
        assertThat(result.skippedRows()).isZero();
    }

    @Test
    void importFrom_withoutNameColumn_fails() throws IOException {
        Path file = workbook("noname.xlsx",
            new Object[] {"Category", "Quantity"},
            new Object[] {"Hardware", 1.0});

        assertThatThrownBy(() -> service.importFrom(file))
            .isInstanceOf(CatalogueFileException.class)
            .hasMessageContaining("'Name' column");
    }

    @Test
    void importFrom_missingFile_fails() {
        assertThatThrownBy(() -> service.importFrom(tempDir.resolve("absent.xlsx")))
            .isInstanceOf(CatalogueFileException.class)
            .hasMessageContaining("File not found");
    }

    @Test
    void importFrom_malformedFile_fails() throws IOException {
        Path file = tempDir.resolve("broken.xlsx");
        Files.writeString(file, "this is not a spreadsheet");

        assertThatThrownBy(() -> service.importFrom(file))
            .isInstanceOf(CatalogueFileException.class)
            .hasMessageContaining("Error reading spreadsheet");
    }

    // ========================================================================
    // Export
    // ========================================================================

    @Test
    void exportTo_thenImport_yieldsSameFieldValues() {
        List<ComponentDto> components = List.of(
            dto(1L, "Bolt M4", "Hardware", "Zinc plated", 25, "pieces", "2.50", "Acme", "Drawer 1", "Metric"),
            dto(2L, "Ribbon", "Textiles", "", 3, "rolls", "0.10", "", "Shelf B", ""),
            dto(3L, "Glue", "", "Hot melt", 0, "sticks", "0.00", "Craft Co", "", "Keep dry"));
        Path file = tempDir.resolve("export.xlsx");

        Path written = service.exportTo(components, file);
        SpreadsheetImportResult reimported = service.importFrom(written);

        assertThat(reimported.skippedRows()).isZero();
        assertThat(reimported.components()).containsExactly(
            request(components.get(0)), request(components.get(1)), request(components.get(2)));
    }

    @Test
    void exportTo_writesHeaderInFixedOrder() throws IOException {
        Path file = service.exportTo(
            List.of(dto(1L, "Bolt M4", "Hardware", "", 25, "pieces", "2.50", "", "", "")),
            tempDir.resolve("header.xlsx"));

        try (Workbook workbook = WorkbookFactory.create(file.toFile())) {
            Sheet sheet = workbook.getSheet(SpreadsheetService.SHEET_NAME);
            assertThat(sheet).isNotNull();

            Row header = sheet.getRow(0);
            String[] headers = new String[header.getLastCellNum()];
            for (int i = 0; i < headers.length; i++) {
                headers[i] = header.getCell(i).getStringCellValue();
            }
            assertThat(headers).containsExactly(Arrays.stream(CatalogueField.values())
                .map(CatalogueField::getHeader)
                .toArray(String[]::new));
            assertThat(header.getCell(0).getCellStyle().getFillForegroundColor()).isNotZero();
            assertThat(sheet.getRow(1).getCell(3).getNumericCellValue()).isEqualTo(25.0);
        }
    }

    @Test
    void exportTo_unwritableLocation_fails() {
        Path file = tempDir.resolve("missing-dir").resolve("export.xlsx");

        assertThatThrownBy(() -> service.exportTo(List.of(), file))
            .isInstanceOf(CatalogueFileException.class)
            .hasMessageContaining("Error writing spreadsheet");
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Test
    void validate_reportsColumnsAndRows() throws IOException {
        Path file = workbook("valid.xlsx",
            new Object[] {"Item Name", "Qty"},
            new Object[] {"Bolt", 1.0},
            new Object[] {"Nut", 2.0});

        SpreadsheetValidationDto validation = service.validate(file);

        assertThat(validation.valid()).isTrue();
        assertThat(validation.hasNameColumn()).isTrue();
        assertThat(validation.rows()).isEqualTo(2);
        assertThat(validation.columns()).containsExactly("Item Name", "Qty");
        assertThat(validation.errors()).isEmpty();
    }

    @Test
    void validate_withoutNameColumn_isInvalid() throws IOException {
        Path file = workbook("invalid.xlsx",
            new Object[] {"Category"},
            new Object[] {"Hardware"});

        SpreadsheetValidationDto validation = service.validate(file);

        assertThat(validation.valid()).isFalse();
        assertThat(validation.hasNameColumn()).isFalse();
        assertThat(validation.errors()).containsExactly("Missing required 'Name' column");
    }

    @Test
    void validate_unreadableFile_isInvalid() throws IOException {
        Path file = tempDir.resolve("broken.xlsx");
        Files.writeString(file, "not a workbook");

        SpreadsheetValidationDto validation = service.validate(file);

        assertThat(validation.valid()).isFalse();
        assertThat(validation.errors()).singleElement().asString().startsWith("Error reading file");
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Path workbook(String name, Object[]... rows) throws IOException {
        Path file = tempDir.resolve(name);
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Sheet1");
            for (int r = 0; r < rows.length; r++) {
                Row row = sheet.createRow(r);
                for (int c = 0; c < rows[r].length; c++) {
                    Object value = rows[r][c];
                    if (value instanceof String text) {
                        row.createCell(c).setCellValue(text);
                    } else if (value instanceof Double number) {
                        row.createCell(c).setCellValue(number);
                    }
                }
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }
        }
        return file;
    }

    private static ComponentDto dto(Long id, String name, String category, String description, int quantity,
                                    String unit, String cost, String supplier, String location, String notes) {
        LocalDateTime now = LocalDateTime.now();
        return new ComponentDto(id, name, category, description, quantity, unit, new BigDecimal(cost),
            supplier, location, notes, now, now);
    }

    private static ComponentRequest request(ComponentDto dto) {
        return new ComponentRequest(dto.name(), dto.category(), dto.description(), dto.quantity(), dto.unit(),
            dto.costPerUnit(), dto.supplier(), dto.location(), dto.notes());
    }
}
