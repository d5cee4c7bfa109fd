package org.optiroute.routing.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteRankerTest {

    private record Option(String name, double cost, double hours, double co2) implements Rankable {
        @Override
        public double rankingCost() {
            return cost;
        }

        @Override
        public double rankingDurationHours() {
            return hours;
        }

        @Override
        public double rankingCo2Kg() {
            return co2;
        }
    }

    private static final Option CHEAP_SLOW = new Option("cheap-slow", 1_000.0d, 300.0d, 2_000.0d);
    private static final Option FAST_DEAR = new Option("fast-dear", 60_000.0d, 10.0d, 30_000.0d);
    private static final Option GREEN = new Option("green", 5_000.0d, 200.0d, 100.0d);

    private final RouteRanker ranker = new RouteRanker(ScoringCeilings.defaults());

    @ParameterizedTest
    @CsvSource({
            "1, 0, 0, cheap-slow",
            "0, 1, 0, fast-dear",
            "0, 0, 1, green"
    })
    @DisplayName("Single priority picks the route best on that metric")
    void testSinglePriority(double cost, double speed, double sustainability, String expected) {
        List<RouteRanker.RankedRoute<Option>> ranked = ranker.rank(
                List.of(CHEAP_SLOW, FAST_DEAR, GREEN), ScoringWeights.of(cost, speed, sustainability));

        assertEquals(expected, ranked.get(0).route().name());
    }

    @Test
    @DisplayName("Scores are relative to fixed ceilings, not to the candidate set")
    void testScoresIndependentOfSet() {
        double alone = ranker.rank(List.of(GREEN), ScoringWeights.balanced()).get(0).score();
        double together = ranker.rank(List.of(CHEAP_SLOW, GREEN, FAST_DEAR), ScoringWeights.balanced()).stream()
                .filter(r -> r.route() == GREEN)
                .findFirst()
                .orElseThrow()
                .score();

        assertEquals(alone, together, 1e-12);
        assertEquals(1.0d - 5_000.0d / 100_000.0d, ranker.rank(List.of(GREEN), ScoringWeights.balanced())
                .get(0).costScore(), 1e-12);
    }

    @Test
    @DisplayName("Values above the ceiling score zero and zero values score one")
    void testSubScoreBounds() {
        assertEquals(0.0d, RouteRanker.subScore(200_000.0d, 100_000.0d), 0.0d);
        assertEquals(1.0d, RouteRanker.subScore(0.0d, 100_000.0d), 0.0d);
        assertEquals(0.5d, RouteRanker.subScore(50.0d, 100.0d), 1e-12);
    }

    @Test
    @DisplayName("Equal scores fall back to lower cost, then input order")
    void testTieBreaks() {
        Option a = new Option("a", 100.0d, 1.0d, 1.0d);
        Option b = new Option("b", 100.0d, 1.0d, 1.0d);
        Option cheaper = new Option("cheaper", 90.0d, 1.0d, 1.0d);

        List<RouteRanker.RankedRoute<Option>> byOrder = ranker.rank(List.of(a, b), ScoringWeights.of(0.0d, 1.0d, 0.0d));
        List<RouteRanker.RankedRoute<Option>> byCost = ranker.rank(List.of(a, cheaper), ScoringWeights.of(0.0d, 1.0d, 0.0d));

        assertEquals("a", byOrder.get(0).route().name());
        assertEquals(1, byOrder.get(1).inputIndex());
        assertEquals("cheaper", byCost.get(0).route().name());
    }

    @Test
    @DisplayName("Ranking is deterministic")
    void testDeterminism() {
        List<Option> options = List.of(CHEAP_SLOW, FAST_DEAR, GREEN);

        assertEquals(ranker.rank(options, ScoringWeights.balanced()), ranker.rank(options, ScoringWeights.balanced()));
    }

    @ParameterizedTest
    @CsvSource({
            "-1, 1, 1",
            "0, 0, 0",
            "NaN, 1, 1",
            "1, Infinity, 1"
    })
    @DisplayName("Negative, non-finite or all-zero weights are rejected")
    void testInvalidWeights(double cost, double speed, double sustainability) {
        ScoringException ex = assertThrows(ScoringException.class,
                () -> ranker.rank(List.of(GREEN), ScoringWeights.of(cost, speed, sustainability)));
        assertEquals(ScoringException.REASON_INVALID_WEIGHTS, ex.getReasonCode());
    }

    @Test
    @DisplayName("Empty input ranks to an empty list")
    void testEmptyInput() {
        assertTrue(ranker.rank(List.<Option>of(), ScoringWeights.balanced()).isEmpty());
    }
}
