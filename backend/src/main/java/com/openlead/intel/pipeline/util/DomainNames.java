package com.openlead.intel.pipeline.util;

import com.openlead.intel.pipeline.model.Company;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class DomainNames {
    private DomainNames() {
    }

    /**
     * Host of {@code url} without a leading {@code www.}; a missing scheme is treated as https.
     * Returns null when no host can be parsed.
     */
    public static String extract(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String value = url.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        String host;
        try {
            host = new URI(value).getHost();
        } catch (URISyntaxException e) {
            return null;
        }
        return stripWww(host);
    }

    /**
     * Identity domain of a company: its explicit domain when set, otherwise the website host.
     */
    public static String normalize(Company company) {
        if (company == null) {
            return null;
        }
        if (company.getDomain() != null) {
            return stripWww(company.getDomain());
        }
        return extract(company.getWebsite());
    }

    public static String normalizeUrl(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String value = url.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    /**
     * Scheme, host and port of {@code url}, e.g. {@code https://example.com:8443}; null when unparseable.
     */
    public static String origin(String url) {
        String normalized = normalizeUrl(url);
        if (normalized.isEmpty()) {
            return null;
        }
        try {
            URI uri = new URI(normalized);
            if (uri.getHost() == null) {
                return null;
            }
            String port = uri.getPort() == -1 ? "" : ":" + uri.getPort();
            return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getHost().toLowerCase(Locale.ROOT) + port;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String stripWww(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        String lower = host.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("www.")) {
            lower = lower.substring(4);
        }
        return lower.isEmpty() ? null : lower;
    }
}
