package com.edgeplatform.analysis.config;

import com.edgeplatform.common.model.RiskProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pipeline settings bound from {@code edge.*}.
 *
 * <p>{@code profile} names one of the built-in presets (conservative, balanced, aggressive) or an
 * entry of {@code profiles}; unknown names fall back to balanced.
 */
@Configuration
@ConfigurationProperties(prefix = "edge")
@Data
@Validated
public class EdgeProperties {

    @NotBlank
    private String profile = "balanced";

    /** Custom presets, keyed by name. Take precedence over the built-in ones. */
    private Map<String, RiskProfile> profiles = new LinkedHashMap<>();

    @Positive
    private double bankroll = 10_000.0;

    @Valid
    private Simulation simulation = new Simulation();

    @Valid
    private Markets markets = new Markets();

    @Valid
    private FakeOdds fakeOdds = new FakeOdds();

    @Valid
    private Feed feed = new Feed();

    public RiskProfile activeProfile() {
        RiskProfile custom = profiles.get(profile.toLowerCase(Locale.ROOT));
        return custom != null ? custom : RiskProfile.named(profile);
    }

    @Data
    public static class Simulation {
        @Min(100)
        private int trials = 10_000;

        /** Root seed for per-game random streams; unset means a clock-derived seed. */
        private Long seed;

        private boolean parallel = true;
    }

    @Data
    public static class Markets {
        private boolean moneyline = true;
        private boolean totals = true;
    }

    @Data
    public static class FakeOdds {
        @Positive
        private double totalLine = 8.5;

        @DecimalMin("1.01")
        private double overOdds = 1.95;

        @DecimalMin("1.01")
        private double underOdds = 1.95;

        /** Bookmaker margin shaded onto the fair moneyline. */
        @PositiveOrZero
        @DecimalMax("0.20")
        private double moneylineMargin = 0.045;
    }

    @Data
    public static class Feed {
        private String location = "classpath:feed/games.json";
    }
}
