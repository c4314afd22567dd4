package com.edgeplatform.common.league;

/**
 * League-wide MLB priors and sample thresholds shared by the metric builders,
 * the projection model and the validators.
 */
public final class MlbConstants {

    private MlbConstants() {}

    // ── League averages (priors) ─────────────────────────────────────────────
    public static final double LEAGUE_ERA          = 4.30;
    public static final double LEAGUE_FIP          = 4.20;
    public static final double LEAGUE_K9           = 8.60;
    public static final double LEAGUE_BB9          = 3.30;
    public static final double LEAGUE_RPG          = 4.60;
    public static final double LEAGUE_OPS          = 0.715;
    public static final double LEAGUE_WRC_PLUS     = 100.0;
    public static final double LEAGUE_BULLPEN_ERA  = 4.20;
    public static final double LEAGUE_FPCT         = 0.985;
    public static final double LEAGUE_ERRORS_PER_GAME = 0.55;

    // ── Shrinkage prior weights (virtual sample sizes) ───────────────────────
    public static final double EB_IP    = 20.0;
    public static final double EB_GAMES = 162.0;

    // ── Sample thresholds ────────────────────────────────────────────────────
    public static final double MIN_IP_CONFIDENT      = 25.0;
    public static final int    MIN_GAMES_CONFIDENT   = 40;
    public static final double MIN_BULLPEN_IP        = 30.0;
    public static final double BULLPEN_SHARE_OF_TEAM_IP = 0.40;
    public static final int    FATIGUE_DAYS_REST     = 4;

    // ── Game structure ───────────────────────────────────────────────────────
    public static final int REGULATION_INNINGS = 9;
    public static final int STARTER_INNINGS    = 6;
    public static final int BULLPEN_INNINGS    = 3;
}
