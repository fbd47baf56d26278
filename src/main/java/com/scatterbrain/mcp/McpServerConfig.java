package com.scatterbrain.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link PlanTools} with the Spring AI MCP server, which serves them over HTTP/SSE
 * in serve mode.
 */
@Configuration
public class McpServerConfig {

    @Bean
    public ToolCallbackProvider planToolCallbacks(PlanTools planTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(planTools)
                .build();
    }
}
