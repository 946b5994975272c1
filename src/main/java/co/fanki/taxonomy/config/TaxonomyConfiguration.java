package co.fanki.taxonomy.config;

import co.fanki.taxonomy.formula.domain.FormulaGraphWalker;
import co.fanki.taxonomy.hierarchy.domain.HierarchyListener;
import co.fanki.taxonomy.hierarchy.domain.LoggingHierarchyListener;
import co.fanki.taxonomy.hierarchy.domain.ScopedHierarchyExtractor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the hierarchy and formula builders.
 *
 * <p>The domain classes carry no Spring annotations; they are built here
 * so they can be created directly in tests.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class TaxonomyConfiguration {

    /**
     * Reports data quality events to the application log.
     *
     * @return the hierarchy listener
     */
    @Bean
    public HierarchyListener hierarchyListener() {
        return new LoggingHierarchyListener();
    }

    /**
     * Builds presentation and dimension hierarchies.
     *
     * @param listener the hierarchy listener
     * @return the extractor
     */
    @Bean
    public ScopedHierarchyExtractor scopedHierarchyExtractor(
            final HierarchyListener listener) {
        return new ScopedHierarchyExtractor(listener);
    }

    /**
     * Builds formula hierarchies.
     *
     * @param maxDepth the deepest formula level expanded
     * @param listener the hierarchy listener
     * @return the walker
     */
    @Bean
    public FormulaGraphWalker formulaGraphWalker(
            @Value("${taxonomy.formula.max-depth:100}") final int maxDepth,
            final HierarchyListener listener) {
        return new FormulaGraphWalker(maxDepth, listener);
    }

}
