package com.openlead.intel.pipeline.enrich;

import com.openlead.intel.pipeline.service.PipelineConfigurationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class EnricherRegistry {
    private final Map<String, Enricher> enrichers = new LinkedHashMap<>();

    public EnricherRegistry(List<Enricher> enrichers) {
        for (Enricher enricher : enrichers) {
            String key = normalize(enricher.name());
            if (this.enrichers.putIfAbsent(key, enricher) != null) {
                throw new IllegalStateException("Duplicate enricher name: " + enricher.name());
            }
        }
    }

    public Set<String> names() {
        return enrichers.keySet();
    }

    public Enricher get(String name) {
        Enricher enricher = name == null ? null : enrichers.get(normalize(name));
        if (enricher == null) {
            throw new PipelineConfigurationException(
                "unknown enricher '" + name + "', expected one of " + enrichers.keySet()
            );
        }
        return enricher;
    }

    /**
     * Resolves names in the order given; that order is the order enrichers run in.
     */
    public List<Enricher> resolve(List<String> names) {
        List<Enricher> out = new ArrayList<>();
        if (names == null) {
            return out;
        }
        for (String name : names) {
            Enricher enricher = get(name);
            if (!out.contains(enricher)) {
                out.add(enricher);
            }
        }
        return out;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
