package com.openlead.intel.pipeline.model;

public enum DataSource {
    PRODUCT_HUNT,
    ANGELLIST,
    CRUNCHBASE,
    CLUTCH,
    JOB_BOARDS,
    LINKEDIN,
    MANUAL,
    API,
    OTHER
}
