package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.hierarchy.domain.SkippedRelationship.Reason;
import co.fanki.taxonomy.shared.Preconditions;
import co.fanki.taxonomy.source.Relationship;
import co.fanki.taxonomy.source.TaxonomyObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw relationships into edges a hierarchy can be built from.
 *
 * <p>A relationship is dropped when an endpoint is missing or has no
 * qualified name. Dropped relationships are kept in the result and
 * reported to the listener; they never fail the collection.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EdgeCollector {

    private final HierarchyListener listener;

    /**
     * Creates a new EdgeCollector.
     *
     * @param theListener receives one event per dropped relationship
     */
    public EdgeCollector(final HierarchyListener theListener) {
        this.listener = Preconditions.requireNonNull(theListener,
                "Hierarchy listener is required");
    }

    /**
     * Collects the valid edges of a scope.
     *
     * @param scope the scope the relationships belong to
     * @param relationships the relationships in document order
     * @return the edges and the dropped relationships
     */
    public CollectedEdges collect(final Scope scope,
            final Iterable<Relationship> relationships) {
        Preconditions.requireNonNull(scope, "Scope is required");
        Preconditions.requireNonNull(relationships,
                "Relationships are required");

        final List<Edge> edges = new ArrayList<>();
        final List<SkippedRelationship> skipped = new ArrayList<>();
        int total = 0;

        for (final Relationship relationship : relationships) {
            total++;
            final TaxonomyObject parent = relationship.fromModelObject();
            final TaxonomyObject child = relationship.toModelObject();

            final Reason reason = rejection(parent, child);
            if (reason != null) {
                final SkippedRelationship skip =
                        new SkippedRelationship(parent, child, reason);
                skipped.add(skip);
                listener.edgeSkipped(scope, skip);
                continue;
            }
            edges.add(new Edge(parent, child, scope));
        }

        return new CollectedEdges(edges, skipped, total);
    }

    private static Reason rejection(final TaxonomyObject parent,
            final TaxonomyObject child) {
        if (parent == null || child == null) {
            return Reason.MISSING_ENDPOINT;
        }
        if (parent.qname() == null || child.qname() == null) {
            return Reason.MISSING_IDENTITY;
        }
        return null;
    }

}
