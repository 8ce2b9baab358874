package com.craftcatalogue.model.enums;

/**
 * Printable report variants.
 */
public enum ReportLayout {
    CATALOGUE("Catalogue"),
    DETAILS("Component Details"),
    CATEGORY_SUMMARY("Category Summary");

    private final String displayName;

    ReportLayout(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
