package com.craftcatalogue.config;

import java.nio.file.Path;

/**
 * Application settings resolved from {@code catalogue.*} properties.
 */
public record CatalogueSettings(
    Path dataDirectory,
    String defaultUnit,
    String reportTitle,
    String exportFileName,
    String reportFileName
) {

    public static final String DEFAULT_UNIT = "pieces";
    public static final String DEFAULT_REPORT_TITLE = "Crafting Components Catalogue";

    /**
     * Settings used when no configuration is available.
     */
    public static CatalogueSettings defaults() {
        return new CatalogueSettings(
            Path.of(System.getProperty("user.home"), ".craft-catalogue"),
            DEFAULT_UNIT,
            DEFAULT_REPORT_TITLE,
            "crafting_components.xlsx",
            "crafting_catalogue.pdf"
        );
    }
}
