package com.openlead.intel.pipeline.adapter;

import com.openlead.intel.pipeline.model.BatchResult;

public record AdapterInvocation<C>(SourceAdapter<C, ?> adapter, C config) {
    public AdapterInvocation {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter is required");
        }
    }

    public static <C> AdapterInvocation<C> of(SourceAdapter<C, ?> adapter, C config) {
        return new AdapterInvocation<>(adapter, config);
    }

    public String name() {
        return adapter.name();
    }

    public BatchResult execute() {
        return adapter.scrape(config);
    }

    public String describe() {
        return adapter.name() + "[" + config + "]";
    }
}
