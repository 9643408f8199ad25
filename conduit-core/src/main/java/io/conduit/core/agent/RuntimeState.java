package io.conduit.core.agent;

/// Lifecycle state of an {@link AgentRuntime}.
///
/// `UNINITIALIZED → PROCESSOR_READY → (ITERATING ⇄ TOOL_CALL) → DONE | ERROR`.
/// A configuration change or an explicit reset returns to `UNINITIALIZED`.
public enum RuntimeState {
    UNINITIALIZED,
    PROCESSOR_READY,
    ITERATING,
    TOOL_CALL,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
