package com.openlead.intel.pipeline.adapter;

/**
 * A link found on a listing page that may name a company.
 */
public record ListingCandidate(String name, String url, String description, String pageUrl) {
}
