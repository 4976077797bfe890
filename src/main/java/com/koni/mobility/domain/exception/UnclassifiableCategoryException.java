package com.koni.mobility.domain.exception;

/**
 * Raised when a category label matches none of a source's mapping rules.
 * This points at a missing rule, so the affected datastream is skipped and logged at ERROR.
 */
public class UnclassifiableCategoryException extends RuntimeException {

    private final String categoryLabel;

    public UnclassifiableCategoryException(String categoryLabel) {
        super("No category rule matches label '" + categoryLabel + "'");
        this.categoryLabel = categoryLabel;
    }

    public String getCategoryLabel() {
        return categoryLabel;
    }
}
