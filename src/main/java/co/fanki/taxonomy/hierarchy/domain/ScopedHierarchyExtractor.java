package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.shared.Preconditions;
import co.fanki.taxonomy.source.RelationshipSet;
import co.fanki.taxonomy.source.TaxonomySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the unified hierarchy of a relationship category (presentation,
 * dimensions) out of a taxonomy.
 *
 * <p>Arc-roles are processed in the given order. For each arc-role either
 * one scope covers the whole arc-role, or one scope is built per link role
 * in the order the taxonomy reports them. Each scope runs edge collection,
 * adjacency mapping, root resolution and tree materialization, and its
 * result is merged into the unified hierarchy.</p>
 *
 * <p>Holds no state between calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ScopedHierarchyExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            ScopedHierarchyExtractor.class);

    private final HierarchyListener listener;
    private final EdgeCollector edgeCollector;
    private final HierarchyBuilder hierarchyBuilder;

    /**
     * Creates a new ScopedHierarchyExtractor.
     *
     * @param theListener receives the data quality events of every scope
     */
    public ScopedHierarchyExtractor(final HierarchyListener theListener) {
        this.listener = Preconditions.requireNonNull(theListener,
                "Hierarchy listener is required");
        this.edgeCollector = new EdgeCollector(theListener);
        this.hierarchyBuilder = new HierarchyBuilder(theListener);
    }

    /**
     * Extracts and merges the hierarchies of a list of arc-roles.
     *
     * @param source the taxonomy
     * @param arcRoles the arc-roles, in merge order
     * @param perLinkRole whether to build one scope per link role
     * @return the unified hierarchy
     */
    public Hierarchy extract(final TaxonomySource source,
            final List<String> arcRoles, final boolean perLinkRole) {
        Preconditions.requireNonNull(source, "Taxonomy source is required");
        Preconditions.requireNonNull(arcRoles, "Arc-roles are required");

        final Hierarchy unified = new Hierarchy();

        for (final String arcRole : arcRoles) {
            final Optional<RelationshipSet> relationshipSet =
                    source.relationshipSet(arcRole);

            if (relationshipSet.isEmpty()
                    || relationshipSet.get().modelRelationships().isEmpty()) {
                listener.emptyScope(Scope.of(arcRole));
                continue;
            }

            if (!perLinkRole) {
                HierarchyMerger.merge(unified,
                        extractScope(Scope.of(arcRole), relationshipSet.get()));
                continue;
            }

            final Set<String> linkRoles = relationshipSet.get().linkRoleUris();
            for (final String linkRole : linkRoles) {
                final Scope scope = Scope.of(arcRole, linkRole);
                final Optional<RelationshipSet> linkRoleSet =
                        source.relationshipSet(arcRole, linkRole);
                if (linkRoleSet.isEmpty()) {
                    listener.emptyScope(scope);
                    continue;
                }
                HierarchyMerger.merge(unified,
                        extractScope(scope, linkRoleSet.get()));
            }
        }

        return unified;
    }

    /**
     * Builds the hierarchy of a single scope.
     *
     * @param scope the scope
     * @param relationshipSet the relationships of the scope
     * @return the scope's hierarchy
     */
    public Hierarchy extractScope(final Scope scope,
            final RelationshipSet relationshipSet) {
        Preconditions.requireNonNull(scope, "Scope is required");
        Preconditions.requireNonNull(relationshipSet,
                "Relationship set is required");

        final CollectedEdges collected = edgeCollector.collect(scope,
                relationshipSet.modelRelationships());
        final ParentChildMap map = hierarchyBuilder.map(scope,
                collected.edges());
        final Set<String> roots = RootResolver.resolve(map);
        final Hierarchy hierarchy = hierarchyBuilder.build(scope, map, roots);

        LOG.debug("Built {} roots from {} of {} relationships for {}"
                        + " ({} skipped)",
                hierarchy.size(), collected.edges().size(),
                collected.total(), scope, collected.skipped().size());
        return hierarchy;
    }

}
