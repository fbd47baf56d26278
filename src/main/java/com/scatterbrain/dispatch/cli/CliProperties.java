package com.scatterbrain.dispatch.cli;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Client-side settings for the command line.
 *
 * <pre>
 * scatterbrain:
 *   server: http://localhost:3000
 *   plan-id: ${SCATTERBRAIN_PLAN_ID:}
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "scatterbrain")
public class CliProperties {

    /** Base URL of the server the CLI talks to. */
    private String server = "http://localhost:3000";

    /** Plan used by plan-scoped commands when no --plan is given. */
    private Long planId;

    public String getServer() { return server; }
    public void setServer(String server) { this.server = server; }
    public Long getPlanId() { return planId; }
    public void setPlanId(Long planId) { this.planId = planId; }
}
