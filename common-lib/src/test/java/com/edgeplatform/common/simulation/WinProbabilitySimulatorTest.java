package com.edgeplatform.common.simulation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class WinProbabilitySimulatorTest {

    private final WinProbabilitySimulator sequential = new WinProbabilitySimulator(false);

    @Nested
    @DisplayName("simulate()")
    class Simulate {

        @Test
        @DisplayName("evenly matched teams → P(home) ≈ 0.5")
        void symmetric() {
            WinProbability p = sequential.simulate(4.5, 4.5, 4.2, 4.2, 50_000, new SplittableRandom(42));
            assertEquals(0.5, p.homeWinProb(), 0.02);
            assertEquals(1.0, p.homeWinProb() + p.awayWinProb(), 1e-12);
            assertEquals(50_000, p.trials());
        }

        @Test
        @DisplayName("5.0 vs 3.0 runs → P(home) ≈ 0.76")
        void strongerHome() {
            WinProbability p = sequential.simulate(5.0, 3.0, 4.2, 4.2, 50_000, new SplittableRandom(7));
            assertEquals(0.758, p.homeWinProb(), 0.02);
            assertEquals(2.0, p.meanRunDiff(), 0.1);
        }

        @Test
        @DisplayName("better opposing bullpen lowers home chances")
        void bullpenMatters() {
            double vsGoodPen = sequential.simulate(4.5, 4.5, 4.2, 3.0, 50_000, new SplittableRandom(3)).homeWinProb();
            double vsBadPen  = sequential.simulate(4.5, 4.5, 4.2, 5.5, 50_000, new SplittableRandom(3)).homeWinProb();
            assertTrue(vsBadPen > vsGoodPen);
        }

        @Test
        @DisplayName("same seed → identical estimate")
        void deterministic() {
            WinProbability a = sequential.simulate(4.8, 4.1, 4.0, 4.4, 20_000, new SplittableRandom(99));
            WinProbability b = sequential.simulate(4.8, 4.1, 4.0, 4.4, 20_000, new SplittableRandom(99));
            assertEquals(a, b);
        }

        @Test
        @DisplayName("parallel execution reproduces the sequential result exactly")
        void parallelMatchesSequential() {
            WinProbabilitySimulator parallel = new WinProbabilitySimulator(true);
            WinProbability seq = sequential.simulate(4.8, 4.1, 4.0, 4.4, 23_456, new SplittableRandom(11));
            WinProbability par = parallel.simulate(4.8, 4.1, 4.0, 4.4, 23_456, new SplittableRandom(11));
            assertEquals(seq, par);
        }

        @Test
        @DisplayName("streams keyed by event id are independent of call order")
        void streamFactoryKeyed() {
            RandomStreamFactory streams = new RandomStreamFactory(2025L);
            double first = sequential.simulate(4.4, 4.2, 4.2, 4.2, 5_000, streams.streamFor("game-b")).homeWinProb();
            sequential.simulate(4.4, 4.2, 4.2, 4.2, 5_000, streams.streamFor("game-a"));
            double again = sequential.simulate(4.4, 4.2, 4.2, 4.2, 5_000, streams.streamFor("game-b")).homeWinProb();
            assertEquals(first, again);
        }

        @Test
        @DisplayName("non-positive trials or invalid mu are rejected")
        void invalidInput() {
            SplittableRandom rng = new SplittableRandom(1);
            assertThrows(IllegalArgumentException.class, () -> sequential.simulate(4, 4, 4.2, 4.2, 0, rng));
            assertThrows(IllegalArgumentException.class, () -> sequential.simulate(-1, 4, 4.2, 4.2, 100, rng));
            assertThrows(IllegalArgumentException.class, () -> sequential.simulate(Double.NaN, 4, 4.2, 4.2, 100, rng));
        }
    }

    @Nested
    @DisplayName("helpers")
    class Helpers {

        @Test
        @DisplayName("bullpen scale clamps to [0.8, 1.2], unknown ERA is neutral")
        void bullpenScale() {
            assertEquals(1.0, WinProbabilitySimulator.bullpenScale(4.2), 1e-12);
            assertEquals(0.8, WinProbabilitySimulator.bullpenScale(1.5), 1e-12);
            assertEquals(1.2, WinProbabilitySimulator.bullpenScale(7.0), 1e-12);
            assertEquals(1.0, WinProbabilitySimulator.bullpenScale(0.0), 1e-12);
        }

        @Test
        @DisplayName("Poisson sample mean matches lambda")
        void poissonMean() {
            SplittableRandom rng = new SplittableRandom(5);
            long sum = 0;
            int n = 100_000;
            for (int i = 0; i < n; i++) sum += WinProbabilitySimulator.poisson(0.5, rng);
            assertEquals(0.5, (double) sum / n, 0.01);
            assertEquals(0, WinProbabilitySimulator.poisson(0.0, rng));
        }
    }
}
