package com.edgeplatform.common.sport;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.GameEvent;
import com.edgeplatform.common.model.Pick;

import java.time.LocalDate;
import java.util.List;

/**
 * Sport-specific seam of the pick pipeline. The pipeline itself only knows {@link Analysis}
 * and {@link Pick}; everything about where games come from and how they are projected lives
 * behind an adapter.
 */
public interface SportAdapter {

    String sport();

    String league();

    List<GameEvent> getEvents(LocalDate date);

    Analysis analyzeEvent(GameEvent event);

    /** Unstaked candidate picks across every market the adapter evaluates. */
    List<Pick> generatePicks(Analysis analysis);
}
