package com.mediavault.service.terraform;

/**
 * A pre-flight check failed; the run must not start.
 */
public class PreflightException extends Exception {

    private final String check;

    public PreflightException(String check, String message) {
        super(message);
        this.check = check;
    }

    public PreflightException(String check, String message, Throwable cause) {
        super(message, cause);
        this.check = check;
    }

    /**
     * Name of the failed check: {@code root}, {@code tools}, {@code space}, {@code writable} or {@code lock}.
     */
    public String getCheck() {
        return check;
    }
}
