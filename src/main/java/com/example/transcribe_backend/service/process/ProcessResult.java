package com.example.transcribe_backend.service.process;

/**
 * Outcome of one external tool invocation. {@code exitCode} is -1 when the process timed out.
 */
public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {
    private static final int LOG_SNIPPET_MAX = 4_000;

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /** stderr when present, else stdout, truncated for logs and error messages. */
    public String diagnostics() {
        String out = stderr != null && !stderr.isBlank() ? stderr : stdout;
        return truncate(out);
    }

    public static String truncate(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= LOG_SNIPPET_MAX) {
            return output;
        }
        return output.substring(0, LOG_SNIPPET_MAX) + "...";
    }
}
