package io.conduit.server.validation;

/// Makes client-supplied values safe to write into log lines.
///
/// Line breaks are removed so a value cannot start a forged log entry, and
/// long values are cut to {@link #MAX_LENGTH} characters.
///
/// ```
/// LOG.infov("Chat request: session={0}", LogSanitizer.sanitize(sessionId));
/// ```
public final class LogSanitizer {

    /// Longest value written to a log line before truncation.
    public static final int MAX_LENGTH = 256;

    private LogSanitizer() {}

    /// Strips carriage returns and newlines and truncates the result.
    ///
    /// @param value the value to sanitize, may be null
    /// @return sanitized value, or `"null"` if the input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        String flat = value.replace("\r", "").replace("\n", "");
        if (flat.length() <= MAX_LENGTH) {
            return flat;
        }
        return flat.substring(0, MAX_LENGTH) + "...";
    }
}
