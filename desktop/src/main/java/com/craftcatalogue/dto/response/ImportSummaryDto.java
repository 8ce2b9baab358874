package com.craftcatalogue.dto.response;

import java.nio.file.Path;

/**
 * Outcome of a completed spreadsheet import.
 */
public record ImportSummaryDto(
    Path source,
    int importedCount,
    int skippedRows
) {}
