package co.fanki.taxonomy.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Taxonomy Explorer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Describes the taxonomy extraction API.
     *
     * @return the OpenAPI description
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Taxonomy Explorer API")
                        .description("""
                                Taxonomy Explorer - extracts the structure of an XBRL
                                taxonomy for display.

                                ## Sections
                                - **Concepts**: name, type, substitution group, period type, balance
                                - **Presentation**: parent-child trees
                                - **Dimensions**: hypercube, dimension, domain and member trees
                                - **Formulas**: assertion, variable set and filter graphs
                                """)
                        .version("0.0.1"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
