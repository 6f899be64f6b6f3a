package com.mediavault.service.normalize;

/**
 * Exit status and captured output of one finished external tool call.
 */
public class ToolResult {
    private final int exitCode;
    private final String stdout;
    private final String stderr;

    public ToolResult(int exitCode, String stdout, String stderr) {
        this.exitCode = exitCode;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public String getStdout() { return stdout; }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Stderr if the tool wrote any, stdout otherwise. Used in messages and for classification.
     */
    public String diagnostic() {
        String text = stderr != null && !stderr.isBlank() ? stderr : stdout;
        return text == null ? "" : text.trim();
    }
}
