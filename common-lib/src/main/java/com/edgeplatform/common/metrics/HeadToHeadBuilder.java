package com.edgeplatform.common.metrics;

import com.edgeplatform.common.model.HeadToHeadGame;
import com.edgeplatform.common.model.HeadToHeadRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link HeadToHeadRecord} over the current and two previous seasons, weighting
 * older seasons down (1.0, 0.6, 0.4).
 */
public final class HeadToHeadBuilder {

    public static final String NO_DATA         = "no_data";
    public static final String VERY_LOW_SAMPLE = "very_low_sample";

    private static final double   BASE_CONFIDENCE = 0.35;
    private static final double[] SEASON_DECAY    = {1.0, 0.6, 0.4};
    private static final int      MIN_GAMES       = 5;

    private HeadToHeadBuilder() {}

    public static HeadToHeadRecord build(List<HeadToHeadGame> games, int currentSeason) {
        int count = 0;
        int wins = 0;
        double weightedGames = 0.0;
        double weightedWins = 0.0;
        double weightedMargin = 0.0;

        if (games != null) {
            for (HeadToHeadGame game : games) {
                int age = currentSeason - game.season();
                if (age < 0 || age >= SEASON_DECAY.length) continue;
                double weight = SEASON_DECAY[age];
                boolean won = game.runsFor() > game.runsAgainst();
                count++;
                if (won) wins++;
                weightedGames  += weight;
                weightedWins   += won ? weight : 0.0;
                weightedMargin += (game.runsFor() - game.runsAgainst()) * weight;
            }
        }

        if (count == 0) {
            return new HeadToHeadRecord(0, 0.5, 0.5, 0.0, BASE_CONFIDENCE * 0.5, List.of(NO_DATA));
        }

        List<String> flags = new ArrayList<>();
        double confidence = BASE_CONFIDENCE;
        if (count < MIN_GAMES) {
            flags.add(VERY_LOW_SAMPLE);
            confidence *= 0.65;
        }
        return new HeadToHeadRecord(count, (double) wins / count,
            weightedWins / weightedGames, weightedMargin / weightedGames,
            confidence, List.copyOf(flags));
    }
}
