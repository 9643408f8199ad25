package io.conduit.core.agent;

/// Receives the events of an agent turn in order.
///
/// Called on the thread that runs the turn. Implementations should return
/// quickly; slow observers delay the reasoning loop.
@FunctionalInterface
public interface StreamObserver {

    void onResponse(StreamResponse response);
}
