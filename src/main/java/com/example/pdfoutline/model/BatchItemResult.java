package com.example.pdfoutline.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BatchItemResult {
    private final String name;
    private final boolean success;
    private final Outline outline;
    private final String error;

    private BatchItemResult(String name, boolean success, Outline outline, String error) {
        this.name = name;
        this.success = success;
        this.outline = outline;
        this.error = error;
    }

    public static BatchItemResult success(String name, Outline outline) {
        return new BatchItemResult(name, true, outline, null);
    }

    public static BatchItemResult failure(String name, String error) {
        return new BatchItemResult(name, false, null, error);
    }

    public String getName() {
        return name;
    }

    public boolean isSuccess() {
        return success;
    }

    public Outline getOutline() {
        return outline;
    }

    public String getError() {
        return error;
    }
}
