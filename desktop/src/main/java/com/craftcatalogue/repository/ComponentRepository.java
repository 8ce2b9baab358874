package com.craftcatalogue.repository;

import com.craftcatalogue.model.component.CatalogueComponent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for catalogue components.
 */
@Repository
public interface ComponentRepository extends JpaRepository<CatalogueComponent, Long> {

    /**
     * All components, alphabetically.
     */
    List<CatalogueComponent> findAllByOrderByNameAsc();

    /**
     * Components in one category, alphabetically.
     */
    List<CatalogueComponent> findByCategoryOrderByNameAsc(String category);

    /**
     * Search components by name, category or description (case-insensitive).
     * The query must already have LIKE wildcards escaped with '!'.
     * A null category searches all categories.
     */
    @Query("SELECT c FROM CatalogueComponent c WHERE " +
           "(:category IS NULL OR c.category = :category) AND (" +
           "LOWER(c.name) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '!' OR " +
           "LOWER(c.category) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '!' OR " +
           "LOWER(c.description) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '!') " +
           "ORDER BY c.name")
    List<CatalogueComponent> search(@Param("query") String query, @Param("category") String category);

    /**
     * Distinct non-empty categories, sorted.
     */
    @Query("SELECT DISTINCT c.category FROM CatalogueComponent c " +
           "WHERE c.category IS NOT NULL AND c.category <> '' ORDER BY c.category")
    List<String> findDistinctCategories();
}
