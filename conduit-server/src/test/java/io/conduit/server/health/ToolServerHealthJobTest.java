package io.conduit.server.health;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.conduit.core.connection.ConnectionStatus;
import io.conduit.core.tool.ToolOrchestrator;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ToolServerHealthJobTest {

    @Test
    void tickShouldRunHealthChecksBeforeReadingStatus() {
        ToolOrchestrator orchestrator = mock(ToolOrchestrator.class);
        when(orchestrator.getStatus())
                .thenReturn(
                        Map.of(
                                "rag", new ConnectionStatus(true, 2, Instant.now(), 0),
                                "gmail", new ConnectionStatus(false, 0, null, 3)));

        new ToolServerHealthJob(orchestrator).tick();

        InOrder order = inOrder(orchestrator);
        order.verify(orchestrator).performHealthChecks();
        order.verify(orchestrator).getStatus();
    }
}
