package com.mendloop.core.graph;

import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.state.LoopState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConvergenceGraphTest {

    private static LoopState withStatus(LoopStatus status) {
        return new LoopState(Map.of("status", status.name()));
    }

    @Test
    @DisplayName("DONE_PASS routes to finalize")
    void passFinalizes() {
        assertEquals("finalize", ConvergenceGraph.routeAfterValidation(withStatus(LoopStatus.DONE_PASS)));
    }

    @Test
    @DisplayName("DONE_CEILING routes to finalize")
    void ceilingFinalizes() {
        assertEquals("finalize", ConvergenceGraph.routeAfterValidation(withStatus(LoopStatus.DONE_CEILING)));
    }

    @Test
    @DisplayName("ANALYZING routes to analyze")
    void analyzingIterates() {
        assertEquals("analyze", ConvergenceGraph.routeAfterValidation(withStatus(LoopStatus.ANALYZING)));
    }
}
