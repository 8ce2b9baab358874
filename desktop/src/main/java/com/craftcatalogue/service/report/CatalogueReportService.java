package com.craftcatalogue.service.report;

import com.craftcatalogue.config.CatalogueSettings;
import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.dto.response.ComponentStatsDto;
import com.craftcatalogue.exception.CatalogueFileException;
import com.craftcatalogue.model.enums.ReportLayout;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Report Generation Service
 *
 * Renders a set of components into a paginated A4 PDF. Every page carries
 * the report title and a page number.
 */
@Service
@Slf4j
public class CatalogueReportService {

    static final String UNCATEGORIZED = "Uncategorized";
    static final String EMPTY_MESSAGE = "No components found in the catalogue.";

    private static final DateTimeFormatter GENERATED_FORMAT =
        DateTimeFormatter.ofPattern("MMMM d, yyyy 'at' h:mm a", Locale.ENGLISH);

    private static final String[] CATALOGUE_HEADERS = {
        "Name", "Category", "Description", "Qty", "Unit", "Cost/Unit",
        "Total Value", "Supplier", "Location", "Notes"
    };
    private static final float[] CATALOGUE_WIDTHS = {100, 70, 120, 40, 45, 60, 65, 80, 80, 110};
    private static final boolean[] CATALOGUE_RIGHT = {false, false, false, true, false, true, true, false, false, false};

    private static final String[] CATEGORY_HEADERS = {"Name", "Quantity", "Unit", "Cost/Unit", "Total Value"};
    private static final float[] CATEGORY_WIDTHS = {203, 70, 70, 90, 90};
    private static final boolean[] CATEGORY_RIGHT = {false, true, false, true, true};

    private final CatalogueSettings settings;

    public CatalogueReportService(CatalogueSettings settings) {
        this.settings = settings;
    }

    /**
     * Generate a report with the configured title.
     */
    public Path generate(ReportLayout layout, List<ComponentDto> components, Path file) {
        return generate(layout, components, file, settings.reportTitle());
    }

    /**
     * Generate a report.
     *
     * @return the written file
     * @throws CatalogueFileException if the PDF cannot be produced or saved
     */
    public Path generate(ReportLayout layout, List<ComponentDto> components, Path file, String title) {
        PDRectangle pageSize = layout == ReportLayout.CATALOGUE
            ? new PDRectangle(PDRectangle.A4.getHeight(), PDRectangle.A4.getWidth())
            : PDRectangle.A4;

        try (PDDocument document = new PDDocument();
             PdfReportWriter writer = new PdfReportWriter(document, pageSize, title)) {

            switch (layout) {
                case CATALOGUE -> writeCatalogue(writer, components);
                case DETAILS -> writeDetails(writer, components);
                case CATEGORY_SUMMARY -> writeCategorySummary(writer, components);
            }
            writer.finish();
            document.save(file.toFile());

            log.info("Generated {} report with {} components at {}", layout, components.size(), file);
            return file;

        } catch (IOException e) {
            throw new CatalogueFileException("Error creating PDF " + file + ": " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Layouts
    // ========================================================================

    private void writeCatalogue(PdfReportWriter writer, List<ComponentDto> components) throws IOException {
        writeHeading(writer);

        ComponentStatsDto stats = ComponentStatsDto.of(components);
        writer.line("Catalogue Summary:", writer.bold(), 12);
        writer.line("Total Components: " + stats.totalComponents(), writer.regular(), 11);
        writer.line("Total Items: " + stats.totalQuantity(), writer.regular(), 11);
        writer.line("Total Estimated Value: " + money(stats.totalValue()), writer.regular(), 11);
        writer.space(12);

        if (components.isEmpty()) {
            writer.line(EMPTY_MESSAGE, writer.regular(), 11);
            return;
        }

        List<String[]> rows = new ArrayList<>(components.size());
        for (ComponentDto component : components) {
            rows.add(new String[] {
                component.name(),
                component.category(),
                component.description(),
                String.valueOf(component.quantity()),
                component.unit(),
                money(component.costPerUnit()),
                money(component.totalValue()),
                component.supplier(),
                component.location(),
                component.notes()
            });
        }
        writer.table(CATALOGUE_HEADERS, CATALOGUE_WIDTHS, CATALOGUE_RIGHT, rows, 8);
    }

    private void writeDetails(PdfReportWriter writer, List<ComponentDto> components) throws IOException {
        writeHeading(writer);

        if (components.isEmpty()) {
            writer.line(EMPTY_MESSAGE, writer.regular(), 11);
            return;
        }

        int index = 1;
        for (ComponentDto component : components) {
            // keep the heading together with its first lines
            writer.ensureSpace(110);
            writer.line(index++ + ". " + component.name(), writer.bold(), 13);
            writer.line("Category: " + orNa(component.category()), writer.regular(), 10);
            writer.line("Quantity: " + component.quantity() + " " + component.unit(), writer.regular(), 10);
            writer.line("Cost per Unit: " + money(component.costPerUnit()), writer.regular(), 10);
            writer.line("Total Value: " + money(component.totalValue()), writer.regular(), 10);
            writer.line("Supplier: " + orNa(component.supplier()), writer.regular(), 10);
            writer.line("Location: " + orNa(component.location()), writer.regular(), 10);
            if (!isBlank(component.description())) {
                writer.paragraph("Description: " + component.description(), writer.regular(), 10);
            }
            if (!isBlank(component.notes())) {
                writer.paragraph("Notes: " + component.notes(), writer.regular(), 10);
            }
            writer.space(12);
        }
    }

    private void writeCategorySummary(PdfReportWriter writer, List<ComponentDto> components) throws IOException {
        writeHeading(writer);

        if (components.isEmpty()) {
            writer.line(EMPTY_MESSAGE, writer.regular(), 11);
            return;
        }

        for (Map.Entry<String, List<ComponentDto>> group : groupByCategory(components).entrySet()) {
            List<ComponentDto> members = group.getValue();
            ComponentStatsDto stats = ComponentStatsDto.of(members);

            writer.ensureSpace(80);
            writer.line("Category: " + group.getKey(), writer.bold(), 13);
            writer.line("Components: " + stats.totalComponents()
                + " | Total Items: " + stats.totalQuantity()
                + " | Total Value: " + money(stats.totalValue()), writer.regular(), 10);
            writer.space(4);

            List<String[]> rows = new ArrayList<>(members.size());
            for (ComponentDto component : members) {
                rows.add(new String[] {
                    component.name(),
                    String.valueOf(component.quantity()),
                    component.unit(),
                    money(component.costPerUnit()),
                    money(component.totalValue())
                });
            }
            writer.table(CATEGORY_HEADERS, CATEGORY_WIDTHS, CATEGORY_RIGHT, rows, 8);
            writer.space(16);
        }
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private void writeHeading(PdfReportWriter writer) throws IOException {
        writer.newPage();
        writer.centeredLine("Generated on " + LocalDateTime.now().format(GENERATED_FORMAT), writer.regular(), 10);
        writer.space(10);
    }

    /**
     * Components grouped by category (blank as "Uncategorized"), groups and members sorted by name.
     */
    static Map<String, List<ComponentDto>> groupByCategory(List<ComponentDto> components) {
        Map<String, List<ComponentDto>> groups = new TreeMap<>();
        for (ComponentDto component : components) {
            String category = isBlank(component.category()) ? UNCATEGORIZED : component.category();
            groups.computeIfAbsent(category, key -> new ArrayList<>()).add(component);
        }
        groups.values().forEach(members ->
            members.sort(Comparator.comparing(ComponentDto::name, String.CASE_INSENSITIVE_ORDER)));
        return groups;
    }

    private static String money(BigDecimal value) {
        BigDecimal amount = value == null ? BigDecimal.ZERO : value;
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String orNa(String value) {
        return isBlank(value) ? "N/A" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
