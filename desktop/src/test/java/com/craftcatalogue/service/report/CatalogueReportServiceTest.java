package com.craftcatalogue.service.report;

import com.craftcatalogue.config.CatalogueSettings;
import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.exception.CatalogueFileException;
import com.craftcatalogue.model.enums.ReportLayout;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CatalogueReportService}.
 */
class CatalogueReportServiceTest {

    private static final String TITLE = "Workshop Inventory";

    @TempDir
    Path tempDir;

    private CatalogueReportService service;

    @BeforeEach
    void setUp() {
        service = new CatalogueReportService(CatalogueSettings.defaults());
    }

    @Test
    void generate_manyComponents_numbersEveryPageAndRepeatsTitle() throws IOException {
        List<ComponentDto> components = new ArrayList<>();
        for (int i = 1; i <= 120; i++) {
            components.add(component((long) i, String.format("Bead %03d", i), "Beads", 10, "0.25"));
        }
        Path file = tempDir.resolve("catalogue.pdf");

        service.generate(ReportLayout.CATALOGUE, components, file, TITLE);

        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            int pages = document.getNumberOfPages();
            assertThat(pages).isGreaterThan(1);

            for (int page = 1; page <= pages; page++) {
                String text = pageText(document, page);
                assertThat(text).contains(TITLE);
                assertThat(text).contains("Page " + page + " of " + pages);
            }

            String first = pageText(document, 1);
            assertThat(first).contains("Total Components: 120", "Total Items: 1200", "Total Estimated Value: $300.00");
            assertThat(pageText(document, pages)).contains("Bead 120", "Cost/Unit");
        }
    }

    @Test
    void generate_withoutTitle_usesConfiguredTitle() throws IOException {
        Path file = service.generate(ReportLayout.CATALOGUE,
            List.of(component(1L, "Bolt", "Hardware", 1, "1.00")), tempDir.resolve("default.pdf"));

        assertThat(text(file)).contains(CatalogueSettings.DEFAULT_REPORT_TITLE);
    }

    @Test
    void generate_emptyList_producesSinglePageWithMessage() throws IOException {
        for (ReportLayout layout : ReportLayout.values()) {
            Path file = tempDir.resolve(layout.name() + ".pdf");

            service.generate(layout, List.of(), file, TITLE);

            try (PDDocument document = Loader.loadPDF(file.toFile())) {
                assertThat(document.getNumberOfPages()).isEqualTo(1);
                assertThat(pageText(document, 1))
                    .contains(TITLE, CatalogueReportService.EMPTY_MESSAGE, "Page 1 of 1");
            }
        }
    }

    @Test
    void generate_details_listsEveryFieldPerComponent() throws IOException {
        ComponentDto bolt = new ComponentDto(1L, "Bolt M4", "Hardware", "Zinc plated bolt", 25, "pieces",
            new BigDecimal("2.50"), "Acme", "Drawer 1", "Order in bulk", LocalDateTime.now(), LocalDateTime.now());
        ComponentDto glue = component(2L, "Glue", "", 3, "1.00");

        Path file = service.generate(ReportLayout.DETAILS, List.of(bolt, glue), tempDir.resolve("details.pdf"), TITLE);

        assertThat(text(file)).contains(
            "1. Bolt M4",
            "Category: Hardware",
            "Quantity: 25 pieces",
            "Cost per Unit: $2.50",
            "Total Value: $62.50",
            "Supplier: Acme",
            "Location: Drawer 1",
            "Description: Zinc plated bolt",
            "Notes: Order in bulk",
            "2. Glue",
            "Category: N/A",
            "Supplier: N/A");
    }

    @Test
    void generate_categorySummary_groupsWithTotals() throws IOException {
        List<ComponentDto> components = List.of(
            component(1L, "Nut", "Hardware", 10, "0.10"),
            component(2L, "Bolt", "Hardware", 5, "0.20"),
            component(3L, "Ribbon", "", 2, "1.50"));

        Path file = service.generate(ReportLayout.CATEGORY_SUMMARY, components,
            tempDir.resolve("summary.pdf"), TITLE);

        String text = text(file);
        assertThat(text).contains(
            "Category: Hardware",
            "Components: 2 | Total Items: 15 | Total Value: $2.00",
            "Category: " + CatalogueReportService.UNCATEGORIZED,
            "Components: 1 | Total Items: 2 | Total Value: $3.00");
        assertThat(text.indexOf("Category: Hardware")).isLessThan(text.indexOf("Category: Uncategorized"));
        assertThat(text.indexOf("Bolt")).isLessThan(text.indexOf("Nut"));
    }

    @Test
    void generate_unencodableCharacters_areReplaced() throws IOException {
        ComponentDto odd = new ComponentDto(1L, "Scissors ✂ 日本", "Tools", "line one\nline two", 1,
            "pieces", new BigDecimal("4.00"), "", "", "", LocalDateTime.now(), LocalDateTime.now());

        for (ReportLayout layout : ReportLayout.values()) {
            Path file = service.generate(layout, List.of(odd), tempDir.resolve("odd-" + layout.name() + ".pdf"), TITLE);

            assertThat(text(file)).contains("Scissors ?");
        }
    }

    @Test
    void generate_unwritableLocation_fails() {
        Path file = tempDir.resolve("missing-dir").resolve("report.pdf");

        assertThatThrownBy(() -> service.generate(ReportLayout.CATALOGUE, List.of(), file, TITLE))
            .isInstanceOf(CatalogueFileException.class)
            .hasMessageContaining("Error creating PDF");
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    void groupByCategory_sortsGroupsAndMembersByName() {
        Map<String, List<ComponentDto>> groups = CatalogueReportService.groupByCategory(List.of(
            component(1L, "washer", "Hardware", 1, "0.01"),
            component(2L, "Twine", "", 1, "0.50"),
            component(3L, "Anchor", "Hardware", 1, "0.30"),
            component(4L, "Felt", "Fabric", 1, "0.90")));

        assertThat(groups.keySet()).containsExactly("Fabric", "Hardware", CatalogueReportService.UNCATEGORIZED);
        assertThat(groups.get("Hardware")).extracting(ComponentDto::name).containsExactly("Anchor", "washer");
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static String pageText(PDDocument document, int page) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        return stripper.getText(document);
    }

    private static String text(Path file) throws IOException {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            return new PDFTextStripper().getText(document);
        }
    }

    private static ComponentDto component(Long id, String name, String category, int quantity, String cost) {
        LocalDateTime now = LocalDateTime.now();
        return new ComponentDto(id, name, category, "", quantity, "pieces", new BigDecimal(cost),
            "", "", "", now, now);
    }
}
