package com.openlead.intel.pipeline.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class TechStack {
    private final Set<String> languages = new LinkedHashSet<>();
    private final Set<String> frameworks = new LinkedHashSet<>();
    private final Set<String> databases = new LinkedHashSet<>();
    private final Set<String> cloudProviders = new LinkedHashSet<>();
    private final Set<String> tools = new LinkedHashSet<>();
    private final Set<String> analytics = new LinkedHashSet<>();
    private final Set<String> marketing = new LinkedHashSet<>();

    public Set<String> getLanguages() {
        return languages;
    }

    public Set<String> getFrameworks() {
        return frameworks;
    }

    public Set<String> getDatabases() {
        return databases;
    }

    public Set<String> getCloudProviders() {
        return cloudProviders;
    }

    public Set<String> getTools() {
        return tools;
    }

    public Set<String> getAnalytics() {
        return analytics;
    }

    public Set<String> getMarketing() {
        return marketing;
    }

    public List<String> allTechnologies() {
        List<String> all = new ArrayList<>();
        all.addAll(languages);
        all.addAll(frameworks);
        all.addAll(databases);
        all.addAll(cloudProviders);
        all.addAll(tools);
        all.addAll(analytics);
        all.addAll(marketing);
        return all;
    }
}
