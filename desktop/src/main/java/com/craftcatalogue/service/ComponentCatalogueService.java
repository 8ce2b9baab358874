package com.craftcatalogue.service;

import com.craftcatalogue.dto.mapper.ComponentMapper;
import com.craftcatalogue.dto.request.ComponentRequest;
import com.craftcatalogue.model.component.CatalogueComponent;
import com.craftcatalogue.repository.ComponentRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Component Catalogue Service
 *
 * Provides CRUD operations, filtering and search over the catalogue.
 * Requests are validated before anything is written; a rejected request
 * raises a ConstraintViolationException and leaves the store untouched.
 */
@Service
@Transactional
@Validated
@Slf4j
public class ComponentCatalogueService {

    private final ComponentRepository componentRepository;
    private final ComponentMapper componentMapper;

    public ComponentCatalogueService(
            ComponentRepository componentRepository,
            ComponentMapper componentMapper) {
        this.componentRepository = componentRepository;
        this.componentMapper = componentMapper;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    /**
     * List components, optionally restricted to one category.
     * A null or blank category lists everything.
     */
    @Transactional(readOnly = true)
    public List<CatalogueComponent> list(String category) {
        if (category == null || category.isBlank()) {
            return componentRepository.findAllByOrderByNameAsc();
        }
        return componentRepository.findByCategoryOrderByNameAsc(category);
    }

    /**
     * List all components.
     */
    @Transactional(readOnly = true)
    public List<CatalogueComponent> list() {
        return list(null);
    }

    /**
     * Find component by ID.
     */
    @Transactional(readOnly = true)
    public Optional<CatalogueComponent> findById(Long id) {
        return componentRepository.findById(id);
    }

    /**
     * Case-insensitive substring search on name, category and description.
     */
    @Transactional(readOnly = true)
    public List<CatalogueComponent> search(String text, String category) {
        if (text == null || text.isBlank()) {
            return list(category);
        }
        String categoryFilter = category == null || category.isBlank() ? null : category;
        return componentRepository.search(escapeLike(text.trim()), categoryFilter);
    }

    /**
     * Distinct categories in use, sorted.
     */
    @Transactional(readOnly = true)
    public List<String> categories() {
        return componentRepository.findDistinctCategories();
    }

    @Transactional(readOnly = true)
    public long count() {
        return componentRepository.count();
    }

    // ========================================================================
    // Write Operations
    // ========================================================================

    /**
     * Create a new component.
     */
    public CatalogueComponent create(@NotNull @Valid ComponentRequest request) {
        CatalogueComponent saved = componentRepository.save(componentMapper.toEntity(request));
        log.info("Created component {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * Overwrite all fields of an existing component.
     */
    public CatalogueComponent update(@NotNull Long id, @NotNull @Valid ComponentRequest request) {
        CatalogueComponent existing = componentRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Component not found: " + id));

        componentMapper.applyUpdates(existing, request);

        CatalogueComponent saved = componentRepository.save(existing);
        log.info("Updated component {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * Delete a component by ID.
     */
    public void delete(@NotNull Long id) {
        if (!componentRepository.existsById(id)) {
            throw new EntityNotFoundException("Component not found: " + id);
        }
        componentRepository.deleteById(id);
        log.info("Deleted component {}", id);
    }

    /**
     * Insert every request as a new component in a single transaction.
     * All requests are validated first, so one bad row aborts the whole batch.
     */
    public List<CatalogueComponent> importAll(@NotNull List<@Valid ComponentRequest> requests) {
        List<CatalogueComponent> entities = new ArrayList<>(requests.size());
        for (ComponentRequest request : requests) {
            entities.add(componentMapper.toEntity(request));
        }
        List<CatalogueComponent> saved = componentRepository.saveAll(entities);
        log.info("Imported {} components", saved.size());
        return saved;
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private String escapeLike(String text) {
        return text.replace("!", "!!")
            .replace("%", "!%")
            .replace("_", "!_");
    }
}
