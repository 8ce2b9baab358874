package com.craftcatalogue.dto.response;

import com.craftcatalogue.dto.request.ComponentRequest;

import java.util.List;

/**
 * Rows parsed from a spreadsheet and the number of rows rejected.
 */
public record SpreadsheetImportResult(
    List<ComponentRequest> components,
    int skippedRows
) {}
