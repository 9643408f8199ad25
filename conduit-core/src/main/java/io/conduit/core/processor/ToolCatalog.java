package io.conduit.core.processor;

import io.conduit.core.tool.ToolDescriptor;
import io.conduit.core.tool.ToolOrchestrator;
import io.conduit.core.util.JsonCodec;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// Cached view of the available tools and their prompt rendering.
///
/// The tool set is fetched from the {@link ToolOrchestrator} on first use and
/// kept until {@link #invalidate()}; the agent runtime invalidates before it
/// builds a processor, since tool sets can change between turns.
///
/// ### Rendering
/// {@snippet lang="xml" :
/// <tool>
/// <name>rag:search</name>
/// <description>Search the knowledge base (from rag server)</description>
/// <parameters_json_schema>{"type":"object"}</parameters_json_schema>
/// </tool>
/// }
/// Tools are separated by a blank line.
///
/// @implNote Thread-safe. Concurrent first calls may both fetch; the last
/// write wins, which is harmless since both read the same live state.
public final class ToolCatalog {

    static final String NO_TOOLS = "No tools available";

    private final ToolOrchestrator tools;
    private final JsonCodec codec;
    private volatile Map<String, ToolDescriptor> cachedTools;
    private volatile String cachedRendering;

    public ToolCatalog(ToolOrchestrator tools, JsonCodec codec) {
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /// Returns the available tools, fetching them on first use.
    ///
    /// @return tools by namespaced name, never null
    public Map<String, ToolDescriptor> tools() {
        Map<String, ToolDescriptor> current = cachedTools;
        if (current == null) {
            current = Map.copyOf(tools.getAllTools());
            cachedTools = current;
        }
        return current;
    }

    /// Returns the prompt rendering of the available tools.
    ///
    /// @return rendered tool block, or `No tools available`, never null
    public String render() {
        String current = cachedRendering;
        if (current == null) {
            current = doRender();
            cachedRendering = current;
        }
        return current;
    }

    /// Drops the cached tool set and rendering.
    public void invalidate() {
        cachedTools = null;
        cachedRendering = null;
    }

    private String doRender() {
        Map<String, ToolDescriptor> available = tools();
        if (available.isEmpty()) {
            return NO_TOOLS;
        }
        return available.values().stream()
                .sorted((a, b) -> a.namespacedName().compareTo(b.namespacedName()))
                .map(this::renderTool)
                .collect(Collectors.joining("\n\n"));
    }

    private String renderTool(ToolDescriptor tool) {
        return "<tool>\n<name>"
                + tool.namespacedName()
                + "</name>\n<description>"
                + tool.description()
                + " (from "
                + tool.serverName()
                + " server)</description>\n<parameters_json_schema>"
                + codec.toJson(tool.inputSchema())
                + "</parameters_json_schema>\n</tool>";
    }
}
