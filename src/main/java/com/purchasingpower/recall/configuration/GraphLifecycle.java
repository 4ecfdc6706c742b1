package com.purchasingpower.recall.configuration;

import com.purchasingpower.recall.knowledge.GraphStore;
import com.purchasingpower.recall.reflection.ReflectionPipeline;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads the persisted graph on startup and settles interrupted reflection
 * cycles. A snapshot that fails validation stops the application.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphLifecycle {

    private final ReflectionPipeline reflectionPipeline;
    private final GraphStore graphStore;

    @PostConstruct
    public void start() {
        reflectionPipeline.recover();
        log.info("✅ Knowledge graph ready: {}", graphStore.stats());
    }

    @PreDestroy
    public void stop() {
        if (reflectionPipeline.cancel()) {
            log.info("Reflection cycle cancelled for shutdown");
        }
    }
}
