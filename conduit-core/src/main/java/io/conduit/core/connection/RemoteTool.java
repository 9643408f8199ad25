package io.conduit.core.connection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A tool as advertised by a server's tool listing, before namespacing.
///
/// @param name the server-local tool name, not null
/// @param description human-readable description, may be null
/// @param inputSchema JSON-schema-shaped argument contract, may be null
public record RemoteTool(String name, String description, Map<String, Object> inputSchema) {

    public RemoteTool {
        Objects.requireNonNull(name, "name must not be null");
        inputSchema =
                inputSchema != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema))
                        : null;
    }
}
