package co.fanki.taxonomy.hierarchy.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes hierarchy events to the application log.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LoggingHierarchyListener implements HierarchyListener {

    private static final Logger LOG = LoggerFactory.getLogger(
            LoggingHierarchyListener.class);

    @Override
    public void edgeSkipped(final Scope scope,
            final SkippedRelationship skipped) {
        LOG.debug("Skipped relationship {} -> {} in {}: {}",
                skipped.from(), skipped.to(), scope, skipped.reason());
    }

    @Override
    public void cycleTruncated(final Scope scope, final String name) {
        LOG.debug("Cycle detected at {} in {}, not expanded again",
                name, scope);
    }

    @Override
    public void depthExceeded(final Scope scope, final String name,
            final int depth) {
        LOG.info("Max depth reached at {} (depth {}) in {}",
                name, depth, scope);
    }

    @Override
    public void emptyScope(final Scope scope) {
        LOG.info("No relationships found for {}", scope);
    }

}
