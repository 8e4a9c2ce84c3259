package com.openlead.intel.pipeline.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class HiringIntent {
    private int totalOpenPositions;
    private int recentPostings;
    private final Map<String, Integer> departmentCounts = new LinkedHashMap<>();
    private double hiringVelocity;
    private boolean hiring;

    public int getTotalOpenPositions() {
        return totalOpenPositions;
    }

    public void setTotalOpenPositions(int totalOpenPositions) {
        this.totalOpenPositions = Math.max(0, totalOpenPositions);
    }

    public int getRecentPostings() {
        return recentPostings;
    }

    public void setRecentPostings(int recentPostings) {
        this.recentPostings = Math.max(0, recentPostings);
    }

    public Map<String, Integer> getDepartmentCounts() {
        return departmentCounts;
    }

    public double getHiringVelocity() {
        return hiringVelocity;
    }

    public void setHiringVelocity(double hiringVelocity) {
        this.hiringVelocity = Math.round(hiringVelocity * 100.0) / 100.0;
    }

    public boolean isHiring() {
        return hiring;
    }

    public void setHiring(boolean hiring) {
        this.hiring = hiring;
    }
}
