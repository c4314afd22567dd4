package com.edgeplatform.analysis.feed;

import com.edgeplatform.common.model.GameEvent;

import java.time.LocalDate;
import java.util.List;

/** Source of scheduled games with their raw stat inputs. */
public interface GameFeed {

    List<GameEvent> eventsFor(LocalDate date);
}
