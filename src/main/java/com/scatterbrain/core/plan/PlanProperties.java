package com.scatterbrain.core.plan;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Plan store settings under {@code scatterbrain.plans}.
 */
@Component
@ConfigurationProperties(prefix = "scatterbrain.plans")
public class PlanProperties {

    /** Transition log entries kept per plan. */
    private int historySize = 20;

    public int getHistorySize() { return historySize; }
    public void setHistorySize(int historySize) { this.historySize = historySize; }
}
