package com.openlead.intel.pipeline.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public class FundingInfo {
    private FundingStage stage = FundingStage.UNKNOWN;
    private Double totalFunding;
    private LocalDate lastFundingDate;
    private Double lastFundingAmount;
    private final List<String> investors = new ArrayList<>();
    private Double valuation;

    public FundingStage getStage() {
        return stage;
    }

    public void setStage(FundingStage stage) {
        this.stage = stage == null ? FundingStage.UNKNOWN : stage;
    }

    public Double getTotalFunding() {
        return totalFunding;
    }

    public void setTotalFunding(Double totalFunding) {
        this.totalFunding = totalFunding;
    }

    public LocalDate getLastFundingDate() {
        return lastFundingDate;
    }

    public void setLastFundingDate(LocalDate lastFundingDate) {
        this.lastFundingDate = lastFundingDate;
    }

    public Double getLastFundingAmount() {
        return lastFundingAmount;
    }

    public void setLastFundingAmount(Double lastFundingAmount) {
        this.lastFundingAmount = lastFundingAmount;
    }

    public List<String> getInvestors() {
        return investors;
    }

    public Double getValuation() {
        return valuation;
    }

    public void setValuation(Double valuation) {
        this.valuation = valuation;
    }
}
