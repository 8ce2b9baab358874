package com.craftcatalogue.model.component;

import com.craftcatalogue.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

/**
 * A single item in the catalogue.
 * Optional text columns hold empty strings rather than nulls.
 */
@Entity
@Table(name = "components", indexes = {
    @Index(name = "idx_component_name", columnList = "name"),
    @Index(name = "idx_component_category", columnList = "category")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class CatalogueComponent extends AuditableEntity {

    public static final int NAME_LENGTH = 500;
    public static final int TEXT_LENGTH = 255;
    public static final int UNIT_LENGTH = 100;
    public static final int LONG_TEXT_LENGTH = 4000;

    /** Largest cost a {@code DECIMAL(14,2)} column holds. */
    public static final String MAX_COST = "999999999999.99";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = NAME_LENGTH)
    private String name;

    @Column(length = TEXT_LENGTH)
    private String category;

    @Column(length = LONG_TEXT_LENGTH)
    private String description;

    @Column(nullable = false)
    private int quantity;

    @Column(length = UNIT_LENGTH)
    private String unit;

    @Column(name = "cost_per_unit", nullable = false, precision = 14, scale = 2)
    private BigDecimal costPerUnit;

    @Column(length = TEXT_LENGTH)
    private String supplier;

    @Column(length = TEXT_LENGTH)
    private String location;

    @Column(length = LONG_TEXT_LENGTH)
    private String notes;

    /**
     * Quantity multiplied by cost per unit.
     */
    public BigDecimal getTotalValue() {
        BigDecimal cost = costPerUnit != null ? costPerUnit : BigDecimal.ZERO;
        return cost.multiply(BigDecimal.valueOf(quantity));
    }
}
