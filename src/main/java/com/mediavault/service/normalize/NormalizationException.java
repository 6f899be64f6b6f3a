package com.mediavault.service.normalize;

import com.mediavault.model.Disposition;

/**
 * A metadata rewrite that could not be performed or verified. Always carries its category.
 */
public class NormalizationException extends Exception {

    private final Disposition category;

    public NormalizationException(Disposition category, String message) {
        super(message);
        this.category = category;
    }

    public NormalizationException(Disposition category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public Disposition getCategory() {
        return category;
    }
}
