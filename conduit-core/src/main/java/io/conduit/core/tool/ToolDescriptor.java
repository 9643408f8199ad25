package io.conduit.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A tool exposed by a connected server, addressed by its namespaced name.
///
/// Created when a connection's tool list is fetched and discarded with that
/// connection; a reconnect produces fresh descriptors.
///
/// @param namespacedName globally unique `<server>:<localName>`, not null
/// @param description human-readable description, never null
/// @param inputSchema JSON-schema-shaped argument contract, never null
/// @param serverName owning server, not null
/// @param originalName server-local tool name, not null
public record ToolDescriptor(
        String namespacedName,
        String description,
        Map<String, Object> inputSchema,
        String serverName,
        String originalName) {

    /// Description used when a server does not provide one.
    public static final String DEFAULT_DESCRIPTION = "No description";

    public ToolDescriptor {
        Objects.requireNonNull(namespacedName, "namespacedName must not be null");
        Objects.requireNonNull(serverName, "serverName must not be null");
        Objects.requireNonNull(originalName, "originalName must not be null");
        description = description != null ? description : DEFAULT_DESCRIPTION;
        inputSchema =
                inputSchema != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema))
                        : Map.of("type", "object");
    }
}
