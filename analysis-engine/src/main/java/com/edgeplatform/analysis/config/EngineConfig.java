package com.edgeplatform.analysis.config;

import com.edgeplatform.common.market.MoneylineEvaluator;
import com.edgeplatform.common.market.TotalsEvaluator;
import com.edgeplatform.common.model.RiskProfile;
import com.edgeplatform.common.simulation.RandomStreamFactory;
import com.edgeplatform.common.simulation.WinProbabilitySimulator;
import com.edgeplatform.common.staking.StakeEngine;
import com.edgeplatform.common.validation.PickValidator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the pure pipeline components from {@link EdgeProperties}. Every risk-dependent component
 * is built from the same {@link RiskProfile} bean; switching profile means restarting with a new
 * {@code edge.profile}.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Bean
    public RiskProfile riskProfile(EdgeProperties properties) {
        RiskProfile profile = properties.activeProfile();
        log.info("[EngineConfig] Active risk profile={} minEdge={} minConfidence={} kelly={} maxStakePct={} maxPicks={}",
            profile.name(), profile.minEdge(), profile.minConfidence(), profile.kellyFraction(),
            profile.maxStakePct(), profile.maxPicksPerDay());
        return profile;
    }

    @Bean
    public WinProbabilitySimulator winProbabilitySimulator(EdgeProperties properties) {
        return new WinProbabilitySimulator(properties.getSimulation().isParallel());
    }

    @Bean
    public RandomStreamFactory randomStreamFactory(EdgeProperties properties) {
        Long seed = properties.getSimulation().getSeed();
        if (seed == null) {
            log.info("[EngineConfig] No simulation seed configured, results will not be reproducible");
            return RandomStreamFactory.unseeded();
        }
        return new RandomStreamFactory(seed);
    }

    @Bean
    @ConditionalOnProperty(name = "edge.markets.moneyline", havingValue = "true", matchIfMissing = true)
    public MoneylineEvaluator moneylineEvaluator(WinProbabilitySimulator simulator, RandomStreamFactory streams,
                                                 EdgeProperties properties) {
        return new MoneylineEvaluator(simulator, streams, properties.getSimulation().getTrials());
    }

    @Bean
    @ConditionalOnProperty(name = "edge.markets.totals", havingValue = "true", matchIfMissing = true)
    public TotalsEvaluator totalsEvaluator() {
        return new TotalsEvaluator();
    }

    @Bean
    public StakeEngine stakeEngine(RiskProfile profile) {
        return new StakeEngine(profile);
    }

    @Bean
    public PickValidator pickValidator(RiskProfile profile) {
        return new PickValidator(profile);
    }

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        return builder.baseUrl(historyUrl).build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
