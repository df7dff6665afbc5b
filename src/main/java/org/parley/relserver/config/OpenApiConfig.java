package org.parley.relserver.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI configuration for the relations API.
 */
@Configuration
public class OpenApiConfig {

  /**
   * Configures the OpenAPI specification.
   *
   * @return the configured OpenAPI instance
   */
  @Bean
  public OpenAPI customOpenApi() {
    return new OpenAPI()
        .info(new Info()
            .title("Parley Relations API")
            .description("""
                **Event relations and aggregations for chat rooms**

                Clients attach annotations (such as emoji reactions), references \
                (such as replies) and replacements (edits) to an existing event, then \
                page through the raw relations or through per-key annotation counts.

                ## Pagination

                List endpoints return `chunk` and, while more results remain, an opaque \
                `next_batch` token. Pass it back as `from` to get the next, older page. \
                Tokens are bound to the query they were issued for.

                ## Bundling

                Single events and message listings carry a summary of their relations \
                under `unsigned."m.relations"`.

                ## Error Handling

                All errors are RFC 7807 Problem Details (`application/problem+json`) \
                with a stable `code`.
                """)
            .version("1.0.0")
            .license(new License()
                .name("Apache 2.0")
                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
        .addServersItem(new Server()
            .url("http://localhost:8080")
            .description("Development server"));
  }
}
