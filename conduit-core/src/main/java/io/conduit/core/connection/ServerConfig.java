package io.conduit.core.connection;

import io.conduit.core.exception.ConfigurationException;
import java.net.URI;
import java.net.URISyntaxException;

/// Identifies one remote tool server.
///
/// Immutable once loaded. Validation is deferred to {@link #validate()} so that
/// a single bad entry in a configuration list fails only its own connection
/// attempt instead of the whole list.
///
/// @param name unique server name, used as the namespace prefix of its tools
/// @param url base URL of the server, including scheme and usually the port
/// @param port server port, `1..65535`
/// @param endpoint transport path appended to the URL, `/mcp` when null or blank
public record ServerConfig(String name, String url, int port, String endpoint) {

    /// Transport path used when a config does not name one.
    public static final String DEFAULT_ENDPOINT = "/mcp";

    /// Creates a config that uses the default endpoint.
    ///
    /// @param name server name, not null
    /// @param url base URL, not null
    /// @param port server port
    /// @return new config, never null
    public static ServerConfig of(String name, String url, int port) {
        return new ServerConfig(name, url, port, null);
    }

    /// Returns the configured endpoint or {@link #DEFAULT_ENDPOINT}.
    ///
    /// @return endpoint path starting with `/`, never null
    public String endpointOrDefault() {
        if (endpoint == null || endpoint.isBlank()) {
            return DEFAULT_ENDPOINT;
        }
        String trimmed = endpoint.trim();
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }

    /// Checks every field before any I/O is attempted.
    ///
    /// @throws ConfigurationException naming the first invalid field
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("name", "Server name is required");
        }
        if (name.indexOf(':') >= 0) {
            throw new ConfigurationException(
                    "name", "Server name must not contain ':' (got '" + name + "')");
        }
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("url", "Server URL is required");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException(
                    "port", "Server port must be a valid number between 1 and 65535");
        }
        try {
            URI parsed = new URI(url.trim());
            String scheme = parsed.getScheme();
            if (scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || parsed.getHost() == null) {
                throw new ConfigurationException(
                        "url", "Server URL must be an absolute http(s) URL (got '" + url + "')");
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException(
                    "url", "Server URL is malformed: " + e.getMessage());
        }
    }

    /// Builds the transport target by joining the URL and the endpoint.
    ///
    /// When the URL carries no explicit port, {@link #port()} is inserted.
    ///
    /// @return absolute target URI, never null
    /// @throws ConfigurationException if the config is invalid
    public URI targetUri() {
        validate();
        URI base = URI.create(stripTrailingSlash(url.trim()));
        String root;
        if (base.getPort() == -1) {
            String path = base.getRawPath() == null ? "" : base.getRawPath();
            root = base.getScheme() + "://" + base.getRawAuthority() + ":" + port + path;
        } else {
            root = base.toString();
        }
        return URI.create(root + endpointOrDefault());
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
