package com.craftcatalogue.controller;

import com.craftcatalogue.config.CatalogueSettings;
import com.craftcatalogue.dto.mapper.ComponentMapper;
import com.craftcatalogue.dto.request.ComponentRequest;
import com.craftcatalogue.dto.response.ActionResult;
import com.craftcatalogue.dto.response.ActionResult.Kind;
import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.dto.response.ImportSummaryDto;
import com.craftcatalogue.dto.response.SpreadsheetImportResult;
import com.craftcatalogue.dto.response.SpreadsheetValidationDto;
import com.craftcatalogue.exception.CatalogueFileException;
import com.craftcatalogue.model.component.CatalogueComponent;
import com.craftcatalogue.model.enums.ReportLayout;
import com.craftcatalogue.service.ComponentCatalogueService;
import com.craftcatalogue.service.report.CatalogueReportService;
import com.craftcatalogue.service.spreadsheet.SpreadsheetService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Controller;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point for every action the main window offers.
 * Calls the catalogue, spreadsheet and report services and turns any failure
 * into an {@link ActionResult} the window can show, so no exception reaches
 * the Swing event thread.
 */
@Controller
@Slf4j
public class CatalogueController {

    private final ComponentCatalogueService componentService;
    private final SpreadsheetService spreadsheetService;
    private final CatalogueReportService reportService;
    private final ComponentMapper componentMapper;
    private final CatalogueSettings settings;

    public CatalogueController(
            ComponentCatalogueService componentService,
            SpreadsheetService spreadsheetService,
            CatalogueReportService reportService,
            ComponentMapper componentMapper,
            CatalogueSettings settings) {
        this.componentService = componentService;
        this.spreadsheetService = spreadsheetService;
        this.reportService = reportService;
        this.componentMapper = componentMapper;
        this.settings = settings;
    }

    public CatalogueSettings getSettings() {
        return settings;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    /**
     * All components, alphabetically.
     */
    public ActionResult<List<ComponentDto>> loadComponents() {
        try {
            return ActionResult.ok(null, componentMapper.toDtoList(componentService.list()));
        } catch (RuntimeException e) {
            return handle("load components", e);
        }
    }

    /**
     * Categories currently in use.
     */
    public ActionResult<List<String>> loadCategories() {
        try {
            return ActionResult.ok(null, componentService.categories());
        } catch (RuntimeException e) {
            return handle("load categories", e);
        }
    }

    /**
     * A single component, freshly read from the store.
     */
    public ActionResult<ComponentDto> findComponent(Long id) {
        try {
            return componentService.findById(id)
                .map(componentMapper::toDto)
                .map(dto -> ActionResult.ok(null, dto))
                .orElseThrow(() -> new EntityNotFoundException("Component not found: " + id));
        } catch (RuntimeException e) {
            return handle("load component", e);
        }
    }

    // ========================================================================
    // Write Operations
    // ========================================================================

    public ActionResult<ComponentDto> addComponent(ComponentRequest request) {
        try {
            CatalogueComponent saved = componentService.create(request);
            return ActionResult.ok("Component added successfully!", componentMapper.toDto(saved));
        } catch (RuntimeException e) {
            return handle("add component", e);
        }
    }

    public ActionResult<ComponentDto> updateComponent(Long id, ComponentRequest request) {
        try {
            CatalogueComponent saved = componentService.update(id, request);
            return ActionResult.ok("Component updated successfully!", componentMapper.toDto(saved));
        } catch (RuntimeException e) {
            return handle("update component", e);
        }
    }

    public ActionResult<Void> deleteComponent(Long id) {
        try {
            componentService.delete(id);
            return ActionResult.ok("Component deleted successfully!", null);
        } catch (RuntimeException e) {
            return handle("delete component", e);
        }
    }

    // ========================================================================
    // Spreadsheet Import/Export
    // ========================================================================

    /**
     * Validate a spreadsheet, parse it and append every valid row to the catalogue.
     */
    public ActionResult<ImportSummaryDto> importSpreadsheet(Path file) {
        try {
            SpreadsheetValidationDto validation = spreadsheetService.validate(file);
            if (!validation.valid()) {
                log.warn("Rejected spreadsheet {}: {}", file, validation.errors());
                return ActionResult.failure(Kind.FILE,
                    "Failed to import Excel file: " + String.join("; ", validation.errors()));
            }

            SpreadsheetImportResult parsed = spreadsheetService.importFrom(file);
            int imported = componentService.importAll(parsed.components()).size();

            ImportSummaryDto summary = new ImportSummaryDto(file, imported, parsed.skippedRows());
            String message = "Successfully imported " + imported + " components from Excel!";
            if (parsed.skippedRows() > 0) {
                message += " (" + parsed.skippedRows() + " rows skipped)";
            }
            return ActionResult.ok(message, summary);
        } catch (RuntimeException e) {
            return handle("import Excel file", e);
        }
    }

    public ActionResult<Path> exportSpreadsheet(List<ComponentDto> components, Path file) {
        try {
            Path written = spreadsheetService.exportTo(components, file);
            return ActionResult.ok("Components exported to " + written, written);
        } catch (RuntimeException e) {
            return handle("export to Excel", e);
        }
    }

    // ========================================================================
    // Reports
    // ========================================================================

    public ActionResult<Path> printReport(ReportLayout layout, List<ComponentDto> components, Path file) {
        try {
            Path written = reportService.generate(layout, components, file);
            return ActionResult.ok(layout.getDisplayName() + " saved as PDF: " + written, written);
        } catch (RuntimeException e) {
            return handle("create PDF", e);
        }
    }

    // ========================================================================
    // Exception Handling
    // ========================================================================

    private <T> ActionResult<T> handle(String action, RuntimeException ex) {
        if (ex instanceof ConstraintViolationException violation) {
            String details = violation.getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .distinct()
                .sorted()
                .collect(Collectors.joining("; "));
            log.warn("Rejected {}: {}", action, details);
            return ActionResult.failure(Kind.VALIDATION, details);
        }
        if (ex instanceof EntityNotFoundException) {
            log.warn("Could not {}: {}", action, ex.getMessage());
            return ActionResult.failure(Kind.NOT_FOUND, ex.getMessage());
        }
        if (ex instanceof CatalogueFileException) {
            log.error("Could not {}", action, ex);
            return ActionResult.failure(Kind.FILE, "Failed to " + action + ": " + ex.getMessage());
        }
        if (ex instanceof DataAccessException dataAccess) {
            log.error("Storage failure while trying to {}", action, ex);
            return ActionResult.failure(Kind.STORAGE, "Failed to " + action + ": database error ("
                + dataAccess.getMostSpecificCause().getMessage() + ")");
        }
        log.error("Unexpected failure while trying to {}", action, ex);
        return ActionResult.failure(Kind.STORAGE, "Failed to " + action + ": " + ex.getMessage());
    }
}
