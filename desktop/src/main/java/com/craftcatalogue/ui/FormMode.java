package com.craftcatalogue.ui;

/**
 * State of the entry form.
 */
public enum FormMode {
    /** Empty or new entry; Add is available. */
    IDLE,
    /** An existing component is loaded; Update is available. */
    EDITING
}
