package com.craftcatalogue.dto.request;

import com.craftcatalogue.model.component.CatalogueComponent;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Field values for creating a component or overwriting an existing one.
 * Produced by the entry form and by spreadsheet import.
 * Length and range limits match the component columns.
 */
public record ComponentRequest(
    @NotBlank(message = "Component name is required")
    @Size(max = CatalogueComponent.NAME_LENGTH, message = "Name must be at most {max} characters")
    String name,

    @Size(max = CatalogueComponent.TEXT_LENGTH, message = "Category must be at most {max} characters")
    String category,

    @Size(max = CatalogueComponent.LONG_TEXT_LENGTH, message = "Description must be at most {max} characters")
    String description,

    @PositiveOrZero(message = "Quantity must not be negative")
    int quantity,

    @Size(max = CatalogueComponent.UNIT_LENGTH, message = "Unit must be at most {max} characters")
    String unit,

    @NotNull(message = "Cost per unit is required")
    @DecimalMin(value = "0.00", message = "Cost per unit must not be negative")
    @DecimalMax(value = CatalogueComponent.MAX_COST, message = "Cost per unit must be at most " + CatalogueComponent.MAX_COST)
    BigDecimal costPerUnit,

    @Size(max = CatalogueComponent.TEXT_LENGTH, message = "Supplier must be at most {max} characters")
    String supplier,

    @Size(max = CatalogueComponent.TEXT_LENGTH, message = "Location must be at most {max} characters")
    String location,

    @Size(max = CatalogueComponent.LONG_TEXT_LENGTH, message = "Notes must be at most {max} characters")
    String notes
) {}
