package com.openlead.intel.pipeline.model;

public enum FundingStage {
    BOOTSTRAPPED,
    PRE_SEED,
    SEED,
    SERIES_A,
    SERIES_B,
    SERIES_C,
    SERIES_D_PLUS,
    IPO,
    ACQUIRED,
    UNKNOWN
}
