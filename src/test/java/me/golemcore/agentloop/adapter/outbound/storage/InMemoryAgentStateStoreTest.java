package me.golemcore.agentloop.adapter.outbound.storage;

import me.golemcore.agentloop.domain.model.AgentState;
import me.golemcore.agentloop.domain.model.AgentTurn;
import me.golemcore.agentloop.infrastructure.config.AgentLoopConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryAgentStateStoreTest {

    private InMemoryAgentStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryAgentStateStore(AgentLoopConfiguration.objectMapper());
    }

    @Test
    void shouldReturnEmptyForUnknownAgent() {
        assertTrue(store.load("ghost").join().isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void shouldHandOutIndependentCopies() {
        AgentState state = AgentState.builder().agentId("a1").goal("g").build();
        store.save("a1", state).join();

        state.addTurn(AgentTurn.builder().index(0).build());
        AgentState first = store.load("a1").join().orElseThrow();
        first.setGoal("changed");
        AgentState second = store.load("a1").join().orElseThrow();

        assertTrue(first.getTurns().isEmpty());
        assertEquals("g", second.getGoal());
        assertEquals(1, store.size());
    }

    @Test
    void shouldOverwriteOnSave() {
        store.save("a1", AgentState.builder().agentId("a1").goal("first").build()).join();
        store.save("a1", AgentState.builder().agentId("a1").goal("second").build()).join();

        assertEquals("second", store.load("a1").join().orElseThrow().getGoal());
        assertEquals(1, store.size());
    }
}
