package com.example.demo.shortcuts.exception;

import lombok.Getter;

/**
 * Raised when a template build cannot proceed at all (missing inputs,
 * self-referencing expressions). Recoverable problems such as unresolved
 * references never raise this; they are logged and skipped instead.
 */
@Getter
public class TemplateBuildException extends RuntimeException {

    public static final String MISSING_SCHEMA = "MISSING_SCHEMA";
    public static final String MISSING_MENUS = "MISSING_MENUS";
    public static final String CIRCULAR_EXPRESSION = "CIRCULAR_EXPRESSION";
    public static final String BUILD_FAILED = "BUILD_FAILED";

    private final String code;

    public TemplateBuildException(String code, String message) {
        super(message);
        this.code = code;
    }

    public TemplateBuildException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
