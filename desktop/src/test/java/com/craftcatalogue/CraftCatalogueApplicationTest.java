package com.craftcatalogue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CraftCatalogueApplication}.
 */
class CraftCatalogueApplicationTest {

    @Test
    void startupFailureMessage_lockedDatabase_namesInnermostCause() {
        SQLException locked = new SQLException("Database may be already in use: crafting_catalogue.mv.db");
        BeanCreationException failure = new BeanCreationException("entityManagerFactory",
            "Failed to initialize", new IllegalStateException("Unable to open JDBC connection", locked));

        String message = CraftCatalogueApplication.startupFailureMessage(failure);

        assertThat(message)
            .startsWith("Could not start " + CraftCatalogueApplication.APPLICATION_NAME)
            .contains("Database may be already in use")
            .doesNotContain("entityManagerFactory");
    }
}
