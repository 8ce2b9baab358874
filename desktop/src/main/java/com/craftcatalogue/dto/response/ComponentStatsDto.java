package com.craftcatalogue.dto.response;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Totals over a set of components.
 */
public record ComponentStatsDto(
    int totalComponents,
    long totalQuantity,
    BigDecimal totalValue
) {

    public static ComponentStatsDto of(Collection<ComponentDto> components) {
        long quantity = 0;
        BigDecimal value = BigDecimal.ZERO;
        for (ComponentDto component : components) {
            quantity += component.quantity();
            value = value.add(component.totalValue());
        }
        return new ComponentStatsDto(components.size(), quantity, value.setScale(2, RoundingMode.HALF_UP));
    }
}
