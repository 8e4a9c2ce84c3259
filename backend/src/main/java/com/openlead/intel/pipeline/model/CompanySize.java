package com.openlead.intel.pipeline.model;

public enum CompanySize {
    STARTUP,
    SMALL,
    MEDIUM,
    LARGE,
    ENTERPRISE,
    UNKNOWN;

    public static CompanySize fromEmployeeCount(Integer employees) {
        if (employees == null || employees <= 0) {
            return UNKNOWN;
        }
        if (employees <= 10) {
            return STARTUP;
        }
        if (employees <= 50) {
            return SMALL;
        }
        if (employees <= 200) {
            return MEDIUM;
        }
        if (employees <= 1000) {
            return LARGE;
        }
        return ENTERPRISE;
    }
}
