package com.edgeplatform.history.service;

import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.PickSide;
import com.edgeplatform.history.model.PickRecord;

import java.util.List;
import java.util.Locale;

/** Converts between the wire {@link Pick} and the stored {@link PickRecord}. */
final class PickMapper {

    private PickMapper() {}

    /** Expects the numeric pricing fields to be present; the ledger rejects picks without them. */
    static PickRecord toRecord(Pick pick) {
        PickRecord r = new PickRecord();
        r.setEventId(pick.eventId());
        r.setGameDate(pick.gameDate());
        r.setMarket(pick.market() != null ? pick.market().name() : null);
        r.setSide(pick.side() != null ? pick.side().name() : null);
        r.setTeam(pick.team());
        r.setLine(pick.line());
        r.setOdds(pick.odds());
        r.setModelProb(pick.modelProb());
        r.setImpliedProb(pick.impliedProb());
        r.setEdge(pick.edge());
        r.setConfidence(pick.confidence());
        r.setCorrelationMultiplier(pick.correlationMultiplier());
        r.setStakePct(pick.stakePct());
        r.setStake(pick.stake());
        r.setRationale(pick.rationale());
        r.setStatus(PickRecord.PENDING);
        return r;
    }

    /** Unparseable market or side names come back null, which settles UNKNOWN. */
    static Pick toPick(PickRecord r) {
        return new Pick(r.getEventId(), r.getGameDate(), parse(MarketType.class, r.getMarket()),
            parse(PickSide.class, r.getSide()), r.getTeam(), r.getLine(), r.getOdds(), r.getModelProb(),
            r.getImpliedProb(), r.getEdge(), r.getConfidence(), r.getCorrelationMultiplier(),
            r.getStakePct(), r.getStake(), r.getRationale(), List.of());
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String name) {
        if (name == null) return null;
        try {
            return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
