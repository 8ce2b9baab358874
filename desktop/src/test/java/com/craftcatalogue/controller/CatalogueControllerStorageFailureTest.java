package com.craftcatalogue.controller;

import com.craftcatalogue.config.CatalogueSettings;
import com.craftcatalogue.dto.mapper.ComponentMapper;
import com.craftcatalogue.dto.response.ActionResult;
import com.craftcatalogue.dto.response.ActionResult.Kind;
import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.service.ComponentCatalogueService;
import com.craftcatalogue.service.report.CatalogueReportService;
import com.craftcatalogue.service.spreadsheet.SpreadsheetService;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link CatalogueController} when the database cannot be reached.
 */
class CatalogueControllerStorageFailureTest {

    @Test
    void loadComponents_databaseUnavailable_returnsStorageFailureWithRootCause() {
        ComponentCatalogueService service = mock(ComponentCatalogueService.class);
        when(service.list()).thenThrow(new DataAccessResourceFailureException("Could not open connection",
            new SQLException("Database may be already in use")));
        CatalogueSettings settings = CatalogueSettings.defaults();
        CatalogueController controller = new CatalogueController(service, mock(SpreadsheetService.class),
            mock(CatalogueReportService.class), new ComponentMapper(settings), settings);

        ActionResult<List<ComponentDto>> result = controller.loadComponents();

        assertThat(result.success()).isFalse();
        assertThat(result.kind()).isEqualTo(Kind.STORAGE);
        assertThat(result.message())
            .isEqualTo("Failed to load components: database error (Database may be already in use)");
    }
}
