package com.bcnjobs.tracker.scrape.service;

import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.source.SourceAdapter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class SourceAdapterRegistry {
    private final Map<SourceFamily, SourceAdapter> adapters = new EnumMap<>(SourceFamily.class);

    public SourceAdapterRegistry(List<SourceAdapter> adapters) {
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = this.adapters.put(adapter.family(), adapter);
            if (previous != null) {
                throw new IllegalStateException(
                    "Duplicate adapters for " + adapter.family() + ": "
                        + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName()
                );
            }
        }
    }

    public SourceAdapter find(SourceFamily family) {
        return family == null ? null : adapters.get(family);
    }
}
