package io.conduit.core.util;

/// JSON helpers for free-form model output.
///
/// Locates JSON inside text only. Parsing and writing go through the
/// host-supplied {@link JsonCodec}.
public final class JsonUtil {

    private JsonUtil() {}

    /// Extracts the first balanced `{...}` block from free-form model output.
    ///
    /// String literals are honoured, so braces inside strings do not count.
    ///
    /// @param output text possibly containing a JSON object, not null
    /// @return the JSON object text, or null if none is found
    public static String extractJsonFromOutput(String output) {
        int start = output.indexOf('{');
        if (start == -1) {
            return null;
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < output.length(); i++) {
            char c = output.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (!inString) {
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return output.substring(start, i + 1);
                    }
                }
            }
        }
        return null;
    }
}
