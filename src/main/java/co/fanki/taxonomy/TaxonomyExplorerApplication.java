package co.fanki.taxonomy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Taxonomy Explorer Application.
 *
 * <p>Extracts concepts, presentation trees, dimensional hierarchies and
 * formula graphs from XBRL taxonomies and serves them to a presentation
 * layer over HTTP.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class TaxonomyExplorerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(TaxonomyExplorerApplication.class, args);
    }

}
