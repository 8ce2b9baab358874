package com.craftcatalogue.dto.response;

import java.util.List;

/**
 * Result of inspecting a spreadsheet before import.
 */
public record SpreadsheetValidationDto(
    boolean valid,
    int rows,
    List<String> columns,
    boolean hasNameColumn,
    List<String> errors
) {}
