package com.craftcatalogue.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.nio.file.Path;

/**
 * Application configuration.
 * Enables timestamp auditing and exposes the {@code catalogue.*} settings.
 */
@Configuration
@EnableJpaAuditing
public class CatalogueConfig {

    @Value("${catalogue.data-dir:${user.home}/.craft-catalogue}")
    private String dataDir;

    @Value("${catalogue.default-unit:" + CatalogueSettings.DEFAULT_UNIT + "}")
    private String defaultUnit;

    @Value("${catalogue.report.title:" + CatalogueSettings.DEFAULT_REPORT_TITLE + "}")
    private String reportTitle;

    @Value("${catalogue.export.file-name:crafting_components.xlsx}")
    private String exportFileName;

    @Value("${catalogue.report.file-name:crafting_catalogue.pdf}")
    private String reportFileName;

    @Bean
    public CatalogueSettings catalogueSettings() {
        return new CatalogueSettings(
            Path.of(dataDir),
            defaultUnit.isBlank() ? CatalogueSettings.DEFAULT_UNIT : defaultUnit.trim(),
            reportTitle,
            exportFileName,
            reportFileName
        );
    }
}
