package com.craftcatalogue.dto.response;

/**
 * Outcome of a user action: success or failure, a message suitable for a
 * dialog, and the produced value (a component, a file path, ...) on success.
 */
public record ActionResult<T>(
    boolean success,
    Kind kind,
    String message,
    T value
) {

    /**
     * What went wrong, so the window can choose warning vs. error dialogs.
     */
    public enum Kind {
        OK,
        VALIDATION,
        NOT_FOUND,
        STORAGE,
        FILE
    }

    public static <T> ActionResult<T> ok(String message, T value) {
        return new ActionResult<>(true, Kind.OK, message, value);
    }

    public static <T> ActionResult<T> failure(Kind kind, String message) {
        return new ActionResult<>(false, kind, message, null);
    }
}
