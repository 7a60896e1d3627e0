package com.finopti.remediation;

/**
 * What a resolution plan asks the remediation run to do.
 */
public class RemediationPlan {

    public static final String DEFAULT_VALIDATION_QUERY = "error_rate";
    public static final String DEFAULT_BROWSER_SCENARIO = "Verify the reported issue is resolved";

    private final boolean infraChange;
    private final String infraInstruction;
    private final String validationQuery;
    private final boolean browserTestRequested;
    private final String browserTargetUrl;
    private final String browserScenario;

    public RemediationPlan(boolean infraChange, String infraInstruction, String validationQuery,
                           boolean browserTestRequested, String browserTargetUrl, String browserScenario) {
        this.infraChange = infraChange;
        this.infraInstruction = infraInstruction;
        this.validationQuery = validationQuery == null || validationQuery.isBlank()
            ? DEFAULT_VALIDATION_QUERY : validationQuery;
        this.browserTestRequested = browserTestRequested;
        this.browserTargetUrl = browserTargetUrl;
        this.browserScenario = browserScenario == null || browserScenario.isBlank()
            ? DEFAULT_BROWSER_SCENARIO : browserScenario;
    }

    public boolean isInfraChange() {
        return infraChange;
    }

    public String getInfraInstruction() {
        return infraInstruction;
    }

    public String getValidationQuery() {
        return validationQuery;
    }

    public boolean isBrowserTestRequested() {
        return browserTestRequested;
    }

    public String getBrowserTargetUrl() {
        return browserTargetUrl;
    }

    public String getBrowserScenario() {
        return browserScenario;
    }
}
