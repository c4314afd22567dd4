package com.edgeplatform.analysis.feed;

import com.edgeplatform.analysis.config.EdgeProperties;
import com.edgeplatform.common.exception.EdgeException;
import com.edgeplatform.common.model.GameEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * {@link GameFeed} backed by a JSON array of {@link GameEvent}s at {@code edge.feed.location}.
 * The file is read once at startup. A missing file yields an empty slate.
 */
@Component
public class JsonGameFeed implements GameFeed {

    private static final Logger log = LoggerFactory.getLogger(JsonGameFeed.class);

    private final List<GameEvent> games;

    public JsonGameFeed(EdgeProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.games = load(resourceLoader.getResource(properties.getFeed().getLocation()), objectMapper);
    }

    JsonGameFeed(List<GameEvent> games) {
        this.games = List.copyOf(games);
    }

    @Override
    public List<GameEvent> eventsFor(LocalDate date) {
        return games.stream()
            .filter(g -> Objects.equals(g.date(), date))
            .toList();
    }

    private static List<GameEvent> load(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            log.warn("[GameFeed] No game feed at {} (non-fatal), slate is empty", resource.getDescription());
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            List<GameEvent> loaded = objectMapper.readValue(in, new TypeReference<List<GameEvent>>() {});
            log.info("[GameFeed] Loaded {} games from {}", loaded.size(), resource.getDescription());
            return List.copyOf(loaded);
        } catch (IOException e) {
            throw new EdgeException("GameFeed", "Unreadable game feed " + resource.getDescription(), e);
        }
    }
}
