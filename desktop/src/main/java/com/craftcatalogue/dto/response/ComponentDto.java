package com.craftcatalogue.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Read-only view of a persisted component, as shown in the table and passed
 * to the spreadsheet and report converters.
 */
public record ComponentDto(
    Long id,
    String name,
    String category,
    String description,
    int quantity,
    String unit,
    BigDecimal costPerUnit,
    String supplier,
    String location,
    String notes,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public BigDecimal totalValue() {
        return costPerUnit.multiply(BigDecimal.valueOf(quantity));
    }
}
