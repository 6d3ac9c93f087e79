package com.newsinsight.refresh.collector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a source type to its collector.
 * Every {@link SourceCollector} bean is registered at startup.
 */
@Component
@Slf4j
public class CollectorRegistry {

    private final Map<String, SourceCollector> collectors = new ConcurrentHashMap<>();

    public CollectorRegistry(List<SourceCollector> discovered) {
        discovered.forEach(this::register);
        log.info("CollectorRegistry initialized. Available collector types: {}", registeredTypes());
    }

    public Optional<SourceCollector> resolve(String sourceType) {
        if (sourceType == null || sourceType.isBlank()) {
            return Optional.empty();
        }
        SourceCollector collector = collectors.get(normalize(sourceType));
        if (collector == null) {
            log.warn("No collector registered for source type: '{}'", sourceType);
        }
        return Optional.ofNullable(collector);
    }

    /**
     * Registers a collector under its own type, replacing any previous one.
     */
    public void register(SourceCollector collector) {
        String type = normalize(collector.getType());
        SourceCollector previous = collectors.put(type, collector);
        if (previous != null && previous != collector) {
            log.warn("Overriding collector for type '{}': {} -> {}",
                    type, previous.getClass().getSimpleName(), collector.getClass().getSimpleName());
        }
    }

    public Set<String> registeredTypes() {
        return new TreeSet<>(collectors.keySet());
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
