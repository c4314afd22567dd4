package com.edgeplatform.analysis.service;

import com.edgeplatform.analysis.config.EdgeProperties;
import com.edgeplatform.analysis.publisher.PickPublisher;
import com.edgeplatform.common.correlation.CorrelationAdjuster;
import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.GameEvent;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.RiskProfile;
import com.edgeplatform.common.model.ValidationResult;
import com.edgeplatform.common.sport.SportAdapter;
import com.edgeplatform.common.staking.StakeEngine;
import com.edgeplatform.common.validation.PickValidator;
import com.edgeplatform.common.validation.ProjectionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the pick pipeline over a slate of games.
 *
 * <h3>Per game</h3>
 * analyze → projection check → reliability gate → evaluate markets → moneyline/totals
 * correlation → validate.
 *
 * <h3>Per day</h3>
 * The surviving picks of each game date are ranked by edge, then confidence, and cut to the
 * profile's {@code maxPicksPerDay}. Only then are they staked: a moneyline and a totals pick on
 * the same game take the correlation stake multiplier when both are still held, and each staked
 * pick is validated again against the stake cap. Accepted picks are published without blocking.
 *
 * <p>Games run in parallel on {@code boundedElastic}. A failure in one game is logged and that
 * game contributes nothing; the rest of the slate is unaffected.
 */
@Service
public class PickGenerationService {

    private static final Logger log = LoggerFactory.getLogger(PickGenerationService.class);

    static final Comparator<Pick> RANKING = Comparator
        .comparing((Pick p) -> p.edge() != null ? p.edge() : Double.NEGATIVE_INFINITY, Comparator.reverseOrder())
        .thenComparing(p -> p.confidence() != null ? p.confidence() : Double.NEGATIVE_INFINITY, Comparator.reverseOrder())
        .thenComparing(p -> p.eventId() != null ? p.eventId() : "")
        .thenComparing(p -> p.market() != null ? p.market().ordinal() : Integer.MAX_VALUE);

    private final SportAdapter adapter;
    private final StakeEngine stakeEngine;
    private final PickValidator validator;
    private final PickPublisher publisher;
    private final double bankroll;

    public PickGenerationService(SportAdapter adapter, StakeEngine stakeEngine, PickValidator validator,
                                 PickPublisher publisher, EdgeProperties properties) {
        this.adapter     = adapter;
        this.stakeEngine = stakeEngine;
        this.validator   = validator;
        this.publisher   = publisher;
        this.bankroll    = properties.getBankroll();
    }

    public Mono<Analysis> analyze(GameEvent event) {
        return Mono.fromCallable(() -> adapter.analyzeEvent(event))
            .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<List<Pick>> generateForDate(LocalDate date) {
        return Mono.fromCallable(() -> adapter.getEvents(date))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(this::generate);
    }

    public Mono<List<Pick>> generate(List<GameEvent> events) {
        log.info("[PickPipeline] Generating picks for {} games. profile={} bankroll={}",
            events.size(), profile().name(), bankroll);
        return Flux.fromIterable(events)
            .flatMap(event -> Mono.fromCallable(() -> picksForGame(event))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("[PickPipeline] Game failed (non-fatal), skipping. eventId={}", event.eventId(), e);
                    return Mono.just(List.of());
                }))
            .flatMapIterable(picks -> picks)
            .collectList()
            .map(this::applyDailyCap)
            .map(this::stakeHeld)
            .doOnNext(accepted -> {
                log.info("[PickPipeline] Accepted {} picks from {} games", accepted.size(), events.size());
                accepted.forEach(publisher::publishPick);
            });
    }

    /** Per-game pipeline up to validation. Picks come back correlated and valid, not yet staked. */
    List<Pick> picksForGame(GameEvent event) {
        Analysis analysis = adapter.analyzeEvent(event);

        ValidationResult projection = ProjectionValidator.validate(analysis);
        if (!projection.isValid()) {
            log.warn("[PickPipeline] Projection rejected eventId={} errors={}", analysis.eventId(), projection.errors());
            return List.of();
        }
        if (analysis.reliability() != null && !analysis.reliability().usable()) {
            log.info("[PickPipeline] Discarded by reliability gate. eventId={} score={} warnings={}",
                analysis.eventId(), String.format("%.3f", analysis.reliability().score()),
                analysis.reliability().warnings());
            return List.of();
        }
        publisher.publishEvent(analysis);

        List<Pick> accepted = new ArrayList<>();
        for (Pick pick : adapter.generatePicks(analysis)) {
            Pick candidate = pick.market() == MarketType.MONEYLINE ? CorrelationAdjuster.apply(pick, analysis) : pick;
            if (accept(candidate)) {
                accepted.add(candidate);
            }
        }
        return accepted;
    }

    /**
     * Sizes the held picks. A moneyline/totals pair on the same game is staked as correlated;
     * a pick whose partner was rejected or cut is staked alone.
     */
    List<Pick> stakeHeld(List<Pick> held) {
        List<Pick> staked = new ArrayList<>(held.size());
        for (Pick pick : held) {
            Pick sized = stakeEngine.sizeStake(pick, bankroll, partnerOf(pick, held));
            if (accept(sized)) {
                staked.add(sized);
            }
        }
        return staked;
    }

    /** Keeps the best {@code maxPicksPerDay} picks of each game date. */
    List<Pick> applyDailyCap(List<Pick> picks) {
        Map<LocalDate, List<Pick>> byDate = new LinkedHashMap<>();
        for (Pick pick : picks) {
            byDate.computeIfAbsent(pick.gameDate(), d -> new ArrayList<>()).add(pick);
        }
        int cap = profile().maxPicksPerDay();
        List<Pick> kept = new ArrayList<>();
        byDate.forEach((date, dayPicks) -> {
            dayPicks.sort(RANKING);
            kept.addAll(dayPicks.subList(0, Math.min(cap, dayPicks.size())));
            if (dayPicks.size() > cap) {
                log.info("[PickPipeline] Daily cap applied. date={} candidates={} kept={}", date, dayPicks.size(), cap);
            }
        });
        return kept;
    }

    public RiskProfile profile() {
        return validator.profile();
    }

    private boolean accept(Pick pick) {
        ValidationResult result = validator.validate(pick);
        if (!result.isValid()) {
            log.info("[PickPipeline] Rejected eventId={} market={} side={} errors={}",
                pick.eventId(), pick.market(), pick.side(), result.errors());
            return false;
        }
        if (!result.warnings().isEmpty()) {
            log.info("[PickPipeline] Accepted with warnings eventId={} market={} warnings={}",
                pick.eventId(), pick.market(), result.warnings());
        }
        return true;
    }

    /** The other half of a same-game moneyline/totals pair, if it is held. */
    private static Pick partnerOf(Pick pick, List<Pick> held) {
        if (pick.market() != MarketType.MONEYLINE && pick.market() != MarketType.TOTAL) return null;
        MarketType other = pick.market() == MarketType.MONEYLINE ? MarketType.TOTAL : MarketType.MONEYLINE;
        return held.stream()
            .filter(p -> p.market() == other && Objects.equals(p.eventId(), pick.eventId()))
            .findFirst()
            .orElse(null);
    }
}
