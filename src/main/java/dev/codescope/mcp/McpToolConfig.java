package dev.codescope.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link McpToolService} methods as MCP tools. Spring AI's MCP server auto-configuration
 * picks up the {@link ToolCallbackProvider} and exposes each {@code @Tool} method over the
 * configured transport (stdio or SSE).
 */
@Configuration
public class McpToolConfig {

  @Bean
  public ToolCallbackProvider codescopeTools(McpToolService toolService) {
    return MethodToolCallbackProvider.builder().toolObjects(toolService).build();
  }
}
