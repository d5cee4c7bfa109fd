package org.optiroute.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.optiroute.routing.core.OptimizationResult;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    @DisplayName("Sample run prints its selected route")
    void testRunSample() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        OptimizationResult result = Main.runSample(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.startsWith("request sample: 1 route(s)"), output);
        assertTrue(output.contains("sample-"), output);
        assertEquals(2, result.getRoutes().get(0).getCandidate().getStops().size());
        assertTrue(result.getSummary().getUnassignedDestinationIds().isEmpty());
    }

    @Test
    @DisplayName("Sample request is well formed")
    void testSampleRequest() {
        assertEquals("sample", Main.sampleRequest().getRequestId());
        assertEquals(2, Main.sampleRequest().getDestinations().size());
        assertEquals(Main.SAMPLE_DEPARTURE, Main.sampleRequest().getDepartureTime());
    }
}
