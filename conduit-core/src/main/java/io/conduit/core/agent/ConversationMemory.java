package io.conduit.core.agent;

import io.conduit.core.connection.ToolCallResponse;
import io.conduit.core.tool.CallResult;
import io.conduit.core.tool.ToolOrchestrator;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/// Conversation history of one agent session.
///
/// Keeps a bounded window of recent messages in memory, evicting the oldest
/// once the window is full. When a connected server exposes a tool whose name
/// contains {@link #MEMORY_TOOL_MARKER}, each exchange is also written to that
/// tool as long-term memory.
///
/// Long-term writes run on the supplied executor and never fail the caller: a
/// failed write is logged and dropped.
///
/// @implNote Thread-safe. The window is guarded by this instance's monitor.
public final class ConversationMemory {

    private static final Logger logger = Logger.getLogger(ConversationMemory.class.getName());

    public static final int DEFAULT_WINDOW_SIZE = 20;
    public static final int MAX_MEMORY_TEXT_LENGTH = 500;
    public static final String MEMORY_TOOL_MARKER = "save_conversation_memory";

    private final Deque<ConversationMessage> window = new ArrayDeque<>();
    private final int windowSize;
    private final ToolOrchestrator tools;
    private final Executor executor;

    /// Creates a memory.
    ///
    /// @param windowSize maximum messages kept, at least 1
    /// @param tools tool access for long-term writes, not null
    /// @param executor executor for long-term writes, not null
    public ConversationMemory(int windowSize, ToolOrchestrator tools, Executor executor) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1");
        }
        this.windowSize = windowSize;
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /// Returns the recent messages, oldest first.
    ///
    /// @return immutable snapshot, never null
    public synchronized List<ConversationMessage> history() {
        return List.copyOf(window);
    }

    /// Appends a message, evicting the oldest when the window is full.
    ///
    /// @param message message to append, not null
    public synchronized void append(ConversationMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        window.addLast(message);
        while (window.size() > windowSize) {
            window.removeFirst();
        }
    }

    public synchronized void clear() {
        window.clear();
    }

    /// Records a completed exchange.
    ///
    /// The window is updated before this method returns so the next turn sees
    /// the exchange. The long-term write is asynchronous.
    ///
    /// @param userMessage the user's message, not null
    /// @param assistantResponse the final answer, not null
    /// @return completes when the long-term write has finished or failed, never exceptionally
    public CompletableFuture<Void> record(String userMessage, String assistantResponse) {
        Objects.requireNonNull(userMessage, "userMessage must not be null");
        Objects.requireNonNull(assistantResponse, "assistantResponse must not be null");
        synchronized (this) {
            append(ConversationMessage.user(userMessage));
            append(ConversationMessage.assistant(assistantResponse));
        }
        return CompletableFuture.runAsync(
                        () -> persist(userMessage, assistantResponse), executor)
                .exceptionally(
                        error -> {
                            logger.warning("Failed to save conversation memory: " + error);
                            return null;
                        });
    }

    private void persist(String userMessage, String assistantResponse) {
        Optional<String> memoryTool =
                tools.getAllTools().keySet().stream()
                        .filter(name -> name.contains(MEMORY_TOOL_MARKER))
                        .findFirst();
        if (memoryTool.isEmpty()) {
            logger.fine("No conversation memory tool available");
            return;
        }

        write(memoryTool.get(), "User: " + truncate(userMessage, MAX_MEMORY_TEXT_LENGTH));
        write(
                memoryTool.get(),
                "Assistant: " + truncate(assistantResponse, MAX_MEMORY_TEXT_LENGTH));
    }

    private void write(String toolName, String information) {
        CallResult<ToolCallResponse> result =
                tools.callTool(toolName, Map.of("information", information));
        if (!result.success()) {
            logger.warning("Failed to save conversation memory: " + result.error());
        }
    }

    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
