package com.pulsetx.pipeline;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * One pipeline per client session, held in a bounded Caffeine cache that expires idle sessions.
 */
@Component
@Slf4j
public class PipelineSessionRegistry {

    private final Cache<String, CorrelationPipeline> sessions;
    private final CorrelationPipelineFactory pipelineFactory;

    public PipelineSessionRegistry(@Qualifier("pipelineSessionCache") Cache<String, CorrelationPipeline> sessions,
                                   CorrelationPipelineFactory pipelineFactory) {
        this.sessions = sessions;
        this.pipelineFactory = pipelineFactory;
    }

    public String create() {
        String sessionId = UUID.randomUUID().toString();
        sessions.put(sessionId, pipelineFactory.create());
        log.debug("Created pipeline session {}", sessionId);
        return sessionId;
    }

    public Optional<CorrelationPipeline> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    public boolean remove(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        CorrelationPipeline removed = sessions.asMap().remove(sessionId);
        return removed != null;
    }

    public long size() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
