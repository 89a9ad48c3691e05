package dev.codescope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Codescope code-search service.
 *
 * <p>Supports two Spring profiles: {@code web} (REST + MCP SSE on port 8080) and {@code stdio}
 * (MCP stdio transport, no web server).
 */
@SpringBootApplication
public class CodescopeApplication {
  public static void main(String[] args) {
    SpringApplication.run(CodescopeApplication.class, args);
  }
}
