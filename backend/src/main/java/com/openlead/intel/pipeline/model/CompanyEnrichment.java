package com.openlead.intel.pipeline.model;

import java.time.Year;
import java.util.ArrayList;
import java.util.List;

public class CompanyEnrichment {
    private static final int MIN_FOUNDED_YEAR = 1800;

    private TechStack techStack;
    private HiringIntent hiringIntent;
    private FundingInfo fundingInfo;
    private GeographicInfo geographicInfo;
    private SocialProfiles socialProfiles;
    private Integer employeeCount;
    private CompanySize companySize = CompanySize.UNKNOWN;
    private Integer foundedYear;
    private String industry;
    private final List<String> tags = new ArrayList<>();

    public TechStack getTechStack() {
        return techStack;
    }

    public void setTechStack(TechStack techStack) {
        this.techStack = techStack;
    }

    public HiringIntent getHiringIntent() {
        return hiringIntent;
    }

    public void setHiringIntent(HiringIntent hiringIntent) {
        this.hiringIntent = hiringIntent;
    }

    public FundingInfo getFundingInfo() {
        return fundingInfo;
    }

    public void setFundingInfo(FundingInfo fundingInfo) {
        this.fundingInfo = fundingInfo;
    }

    public GeographicInfo getGeographicInfo() {
        return geographicInfo;
    }

    public void setGeographicInfo(GeographicInfo geographicInfo) {
        this.geographicInfo = geographicInfo;
    }

    public SocialProfiles getSocialProfiles() {
        return socialProfiles;
    }

    public void setSocialProfiles(SocialProfiles socialProfiles) {
        this.socialProfiles = socialProfiles;
    }

    public Integer getEmployeeCount() {
        return employeeCount;
    }

    public void setEmployeeCount(Integer employeeCount) {
        this.employeeCount = employeeCount;
    }

    public CompanySize getCompanySize() {
        return companySize;
    }

    public void setCompanySize(CompanySize companySize) {
        this.companySize = companySize == null ? CompanySize.UNKNOWN : companySize;
    }

    public Integer getFoundedYear() {
        return foundedYear;
    }

    public void setFoundedYear(Integer foundedYear) {
        if (foundedYear != null) {
            int currentYear = Year.now().getValue();
            if (foundedYear < MIN_FOUNDED_YEAR || foundedYear > currentYear) {
                throw new IllegalArgumentException("Invalid founded year: " + foundedYear);
            }
        }
        this.foundedYear = foundedYear;
    }

    public String getIndustry() {
        return industry;
    }

    public void setIndustry(String industry) {
        this.industry = industry;
    }

    public List<String> getTags() {
        return tags;
    }
}
