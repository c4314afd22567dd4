package com.edgeplatform.analysis.publisher;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.Pick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * {@link PickPublisher} posting to history-service over HTTP, fire-and-forget.
 * No reactor thread is ever blocked.
 */
@Component
public class RestPickPublisher implements PickPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestPickPublisher.class);

    private final WebClient historyClient;

    public RestPickPublisher(WebClient historyClient) {
        this.historyClient = historyClient;
    }

    @Override
    public void publishEvent(Analysis analysis) {
        historyClient.post()
            .uri("/api/v1/history/events")
            .bodyValue(analysis)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("[Publisher] Event stored. eventId={} status={}",
                                analysis.eventId(), r.getStatusCode()),
                err -> log.warn("[Publisher] Event publish failed (non-critical). eventId={}",
                                analysis.eventId(), err)
            );
    }

    @Override
    public void publishPick(Pick pick) {
        historyClient.post()
            .uri("/api/v1/history/picks")
            .bodyValue(pick)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("[Publisher] Pick stored. eventId={} market={} side={} status={}",
                                pick.eventId(), pick.market(), pick.side(), r.getStatusCode()),
                err -> log.warn("[Publisher] Pick publish failed (non-critical). eventId={} market={}",
                                pick.eventId(), pick.market(), err)
            );
    }
}
