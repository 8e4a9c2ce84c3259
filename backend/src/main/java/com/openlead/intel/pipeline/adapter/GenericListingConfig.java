package com.openlead.intel.pipeline.adapter;

import com.openlead.intel.pipeline.service.PipelineConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;

public record GenericListingConfig(String url, int maxRecords) {
    public GenericListingConfig {
        if (url == null || url.isBlank()) {
            throw new PipelineConfigurationException("listing url must not be blank");
        }
        url = url.trim();
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null
                || (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme))
                || uri.getHost() == null) {
                throw new PipelineConfigurationException("listing url must be an absolute http(s) URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new PipelineConfigurationException("malformed listing url: " + url, e);
        }
        if (maxRecords <= 0) {
            throw new PipelineConfigurationException("maxRecords must be > 0");
        }
    }
}
