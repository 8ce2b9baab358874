package com.craftcatalogue.dto.mapper;

import com.craftcatalogue.config.CatalogueSettings;
import com.craftcatalogue.dto.request.ComponentRequest;
import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.model.component.CatalogueComponent;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mapper for converting between component entities, requests and DTOs.
 */
@Component
public class ComponentMapper {

    private final CatalogueSettings settings;

    public ComponentMapper(CatalogueSettings settings) {
        this.settings = settings;
    }

    // ========================================================================
    // Entity -> DTO Conversions
    // ========================================================================

    /**
     * Convert a component entity to a DTO.
     */
    public ComponentDto toDto(CatalogueComponent entity) {
        if (entity == null) {
            return null;
        }

        return new ComponentDto(
            entity.getId(),
            entity.getName(),
            entity.getCategory(),
            entity.getDescription(),
            entity.getQuantity(),
            entity.getUnit(),
            entity.getCostPerUnit(),
            entity.getSupplier(),
            entity.getLocation(),
            entity.getNotes(),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }

    /**
     * Convert a list of components to DTOs.
     */
    public List<ComponentDto> toDtoList(List<CatalogueComponent> entities) {
        if (entities == null) {
            return Collections.emptyList();
        }
        return entities.stream()
            .map(this::toDto)
            .collect(Collectors.toList());
    }

    // ========================================================================
    // Request -> Entity Conversions
    // ========================================================================

    /**
     * Build a new, unsaved entity from a request.
     */
    public CatalogueComponent toEntity(ComponentRequest request) {
        CatalogueComponent entity = new CatalogueComponent();
        applyUpdates(entity, request);
        return entity;
    }

    /**
     * Overwrite every non-identifier field of the entity with the request values.
     */
    public void applyUpdates(CatalogueComponent entity, ComponentRequest request) {
        entity.setName(text(request.name()));
        entity.setCategory(text(request.category()));
        entity.setDescription(text(request.description()));
        entity.setQuantity(request.quantity());
        entity.setUnit(unit(request.unit()));
        entity.setCostPerUnit(normalizeCost(request.costPerUnit()));
        entity.setSupplier(text(request.supplier()));
        entity.setLocation(text(request.location()));
        entity.setNotes(text(request.notes()));
    }

    // ========================================================================
    // DTO -> Request Conversions
    // ========================================================================

    /**
     * Field values of a persisted component, without identifier or timestamps.
     */
    public ComponentRequest toRequest(ComponentDto dto) {
        return new ComponentRequest(
            dto.name(),
            dto.category(),
            dto.description(),
            dto.quantity(),
            dto.unit(),
            dto.costPerUnit(),
            dto.supplier(),
            dto.location(),
            dto.notes()
        );
    }

    /**
     * Costs are kept at two fraction digits so stored values compare equal to their input.
     */
    public BigDecimal normalizeCost(BigDecimal value) {
        return (value == null ? BigDecimal.ZERO : value).setScale(2, RoundingMode.HALF_UP);
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private String text(String value) {
        return value == null ? "" : value.trim();
    }

    private String unit(String value) {
        String unit = text(value);
        return unit.isEmpty() ? settings.defaultUnit() : unit;
    }
}
