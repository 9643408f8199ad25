package io.conduit.server.validation;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/// Input predicates shared by the constraint validators and REST resources.
///
/// ### Session identifiers
/// Start with an alphanumeric character, then alphanumerics, dots, hyphens
/// and underscores, 128 characters at most.
///
/// ### Tool names
/// Same alphabet plus a single `:` separating server and tool, as in
/// `rag:search`. A bare tool name is accepted too.
///
/// ### Control characters
/// U+0000 to U+0008, U+000B, U+000C, U+000E to U+001F and U+007F are rejected
/// in free text. TAB, LF and CR are allowed.
///
/// @see ValidIdValidator
/// @see ValidMessageValidator
public final class InputValidator {

    static final Pattern SAFE_ID = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9._-]{0,127}");

    static final Pattern TOOL_NAME =
            Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9._-]{0,127}(:[a-zA-Z0-9_][a-zA-Z0-9._-]{0,127})?");

    static final Pattern DANGEROUS_CONTROL =
            Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    /// Default limit for a chat message, in UTF-8 bytes (64 KB).
    public static final int MAX_MESSAGE_BYTES = 65_536;

    private InputValidator() {}

    /// Accepts 1 to 128 characters: an alphanumeric first character, then
    /// alphanumerics, dots, hyphens or underscores.
    ///
    /// @param value the string to check, may be null
    /// @return `true` if the value is a usable session identifier
    public static boolean isSafeId(String value) {
        return value != null && SAFE_ID.matcher(value).matches();
    }

    /// @param value the string to check, may be null
    /// @return `true` if the value is a namespaced or bare tool name
    public static boolean isToolName(String value) {
        return value != null && TOOL_NAME.matcher(value).matches();
    }

    /// @param value the string to check, may be null
    /// @return `true` if the value contains a rejected control character
    public static boolean containsDangerousChars(String value) {
        return value != null && DANGEROUS_CONTROL.matcher(value).find();
    }

    /// @param value the string to measure, may be null
    /// @param maxBytes the limit in UTF-8 bytes
    /// @return `true` if the encoded value is larger than the limit
    public static boolean exceedsSizeLimit(String value, int maxBytes) {
        return value != null && value.getBytes(StandardCharsets.UTF_8).length > maxBytes;
    }
}
