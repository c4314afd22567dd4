package com.edgeplatform.analysis.publisher;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.Pick;

/**
 * Hands analyzed games and accepted picks to downstream storage. Implementations must not
 * block the caller and must not propagate delivery failures.
 */
public interface PickPublisher {

    void publishEvent(Analysis analysis);

    void publishPick(Pick pick);
}
