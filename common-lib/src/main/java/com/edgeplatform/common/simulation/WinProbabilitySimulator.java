package com.edgeplatform.common.simulation;

import java.util.SplittableRandom;
import java.util.stream.IntStream;

import static com.edgeplatform.common.league.MlbConstants.*;

/**
 * Inning-by-inning Monte Carlo estimate of P(home wins).
 *
 * <h3>Model</h3>
 * <pre>
 *   innings 1–6 (starters): runs ~ Poisson(mu / 9) per inning
 *   innings 7–9 (bullpens): runs ~ Poisson(mu / 9 × clamp(oppBullpenERA / 4.20, 0.8, 1.2))
 *   regulation tie → fair coin (extra innings as even odds)
 * </pre>
 * The bullpen scaling and the coin-flip tie-break are deliberate approximations; there is no
 * base-out state machine and no leverage model.
 *
 * <p>Trials are split into fixed-size chunks, each drawing from its own {@code split()} of the
 * caller's stream. The chunk streams are derived before any chunk runs, so parallel and
 * sequential execution give identical results for the same seed.
 */
public final class WinProbabilitySimulator {

    public static final int DEFAULT_TRIALS = 10_000;

    private static final int    CHUNK_SIZE = 5_000;
    private static final double MIN_BULLPEN_SCALE = 0.8;
    private static final double MAX_BULLPEN_SCALE = 1.2;

    private final boolean parallel;

    public WinProbabilitySimulator() {
        this(false);
    }

    public WinProbabilitySimulator(boolean parallel) {
        this.parallel = parallel;
    }

    public WinProbability simulate(double homeMu, double awayMu, double homeBullpenEra,
                                   double awayBullpenEra, int trials, SplittableRandom rng) {
        if (trials <= 0) {
            throw new IllegalArgumentException("trials must be positive, got " + trials);
        }
        if (!(homeMu >= 0) || !(awayMu >= 0) || Double.isInfinite(homeMu) || Double.isInfinite(awayMu)) {
            throw new IllegalArgumentException("expected runs must be finite and non-negative");
        }

        double homeStarterRate = homeMu / REGULATION_INNINGS;
        double awayStarterRate = awayMu / REGULATION_INNINGS;
        // Each lineup faces the opposing bullpen late.
        double homeBullpenRate = homeStarterRate * bullpenScale(awayBullpenEra);
        double awayBullpenRate = awayStarterRate * bullpenScale(homeBullpenEra);

        int chunks = (trials + CHUNK_SIZE - 1) / CHUNK_SIZE;
        SplittableRandom[] streams = new SplittableRandom[chunks];
        for (int c = 0; c < chunks; c++) {
            streams[c] = rng.split();
        }

        IntStream indices = IntStream.range(0, chunks);
        if (parallel) indices = indices.parallel();
        long[][] partials = indices.mapToObj(c -> {
            int n = Math.min(CHUNK_SIZE, trials - c * CHUNK_SIZE);
            return runChunk(n, streams[c], homeStarterRate, awayStarterRate, homeBullpenRate, awayBullpenRate);
        }).toArray(long[][]::new);

        long homeWins = 0;
        long runDiff = 0;
        for (long[] p : partials) {
            homeWins += p[0];
            runDiff  += p[1];
        }

        double home = (double) homeWins / trials;
        return new WinProbability(home, 1.0 - home, trials, (double) runDiff / trials);
    }

    /** @return {@code [homeWins, sum(homeRuns − awayRuns)]} */
    private static long[] runChunk(int n, SplittableRandom rng, double homeStarter, double awayStarter,
                                   double homeBullpen, double awayBullpen) {
        long homeWins = 0;
        long runDiff = 0;
        for (int t = 0; t < n; t++) {
            int home = 0;
            int away = 0;
            for (int i = 0; i < STARTER_INNINGS; i++) {
                home += poisson(homeStarter, rng);
                away += poisson(awayStarter, rng);
            }
            for (int i = 0; i < BULLPEN_INNINGS; i++) {
                home += poisson(homeBullpen, rng);
                away += poisson(awayBullpen, rng);
            }
            runDiff += home - away;
            if (home > away || (home == away && rng.nextBoolean())) {
                homeWins++;
            }
        }
        return new long[] {homeWins, runDiff};
    }

    static double bullpenScale(double opposingBullpenEra) {
        if (!(opposingBullpenEra > 0)) return 1.0;
        return Math.max(MIN_BULLPEN_SCALE, Math.min(opposingBullpenEra / LEAGUE_BULLPEN_ERA, MAX_BULLPEN_SCALE));
    }

    /** Knuth's multiplication method; adequate for per-inning rates well below 10. */
    static int poisson(double lambda, SplittableRandom rng) {
        if (lambda <= 0) return 0;
        double limit = Math.exp(-lambda);
        double product = rng.nextDouble();
        int k = 0;
        while (product > limit) {
            k++;
            product *= rng.nextDouble();
        }
        return k;
    }
}
