package co.fanki.taxonomy.hierarchy.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every hierarchy event so tests can assert on them.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RecordingHierarchyListener implements HierarchyListener {

    public final List<SkippedRelationship> skipped = new ArrayList<>();
    public final List<String> cycles = new ArrayList<>();
    public final List<String> depthExceeded = new ArrayList<>();
    public final List<Scope> emptyScopes = new ArrayList<>();

    @Override
    public void edgeSkipped(final Scope scope,
            final SkippedRelationship skippedRelationship) {
        skipped.add(skippedRelationship);
    }

    @Override
    public void cycleTruncated(final Scope scope, final String name) {
        cycles.add(name);
    }

    @Override
    public void depthExceeded(final Scope scope, final String name,
            final int depth) {
        depthExceeded.add(name);
    }

    @Override
    public void emptyScope(final Scope scope) {
        emptyScopes.add(scope);
    }

}
