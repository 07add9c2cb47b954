package com.dealhunt.aggregator.search.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Fixed map of marketplace id to adapter, built once at startup from every
 * {@link ProviderAdapter} bean that reports itself available.
 */
@Component
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderAdapter> byId;

    public ProviderRegistry(List<ProviderAdapter> adapters) {
        Map<String, ProviderAdapter> registered = new TreeMap<>();
        for (ProviderAdapter adapter : adapters) {
            String id = normalizeId(adapter.id());
            if (id == null) {
                throw new IllegalStateException("Provider adapter without id: " + adapter.getClass().getName());
            }
            if (!adapter.isAvailable()) {
                log.info("Marketplace provider {} is not configured; skipping registration", id);
                continue;
            }
            if (registered.putIfAbsent(id, adapter) != null) {
                throw new IllegalStateException("Duplicate marketplace provider id: " + id);
            }
        }
        this.byId = Collections.unmodifiableMap(registered);
        log.info("Registered marketplace providers: {}", byId.keySet());
    }

    public Optional<ProviderAdapter> find(String id) {
        String normalized = normalizeId(id);
        return normalized == null ? Optional.empty() : Optional.ofNullable(byId.get(normalized));
    }

    public boolean isRegistered(String id) {
        return find(id).isPresent();
    }

    public Set<String> providerIds() {
        return byId.keySet();
    }

    /**
     * Resolves a caller's marketplace selection. {@code null} selects every registered
     * provider; unknown ids are dropped. Result is ordered by id.
     */
    public List<ProviderAdapter> select(Collection<String> selection) {
        if (selection == null) {
            return List.copyOf(byId.values());
        }
        Map<String, ProviderAdapter> selected = new TreeMap<>();
        for (String candidate : selection) {
            String id = normalizeId(candidate);
            if (id != null && byId.containsKey(id)) {
                selected.put(id, byId.get(id));
            }
        }
        return new ArrayList<>(selected.values());
    }

    public static String normalizeId(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
