package co.fanki.taxonomy.formula.domain;

import co.fanki.taxonomy.hierarchy.domain.HierarchyListener;
import co.fanki.taxonomy.hierarchy.domain.Scope;
import co.fanki.taxonomy.shared.Preconditions;
import co.fanki.taxonomy.source.ArcRoles;
import co.fanki.taxonomy.source.Relationship;
import co.fanki.taxonomy.source.RelationshipSet;
import co.fanki.taxonomy.source.TaxonomyObject;
import co.fanki.taxonomy.source.TaxonomySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Walks the formula graph of a taxonomy from its root formula objects.
 *
 * <p>For each formula arc-role, in order, every root is walked depth
 * first into the root's own {@link FormulaHierarchy}, so a root
 * accumulates what the assertion-set, variable-set and variable-set-filter
 * arcs contribute. The walk stops descending past {@code maxDepth} and
 * at any object already on the current path; the same object may still be
 * reached again through another branch.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FormulaGraphWalker {

    private static final Logger LOG = LoggerFactory.getLogger(
            FormulaGraphWalker.class);

    /** Depth used when none is configured. */
    public static final int DEFAULT_MAX_DEPTH = 100;

    private final int maxDepth;
    private final HierarchyListener listener;

    /**
     * Creates a new FormulaGraphWalker.
     *
     * @param theMaxDepth the deepest level that is still expanded
     * @param theListener receives cycle, depth and empty arc-role events
     */
    public FormulaGraphWalker(final int theMaxDepth,
            final HierarchyListener theListener) {
        this.maxDepth = Preconditions.requireNonNegative(theMaxDepth,
                "Max depth must be non-negative");
        this.listener = Preconditions.requireNonNull(theListener,
                "Hierarchy listener is required");
    }

    /**
     * Walks the formula graph of a taxonomy.
     *
     * @param source the taxonomy
     * @return the formula hierarchy of each root, keyed by root name
     */
    public Map<String, FormulaHierarchy> walk(final TaxonomySource source) {
        Preconditions.requireNonNull(source, "Taxonomy source is required");

        final List<TaxonomyObject> roots = source.rootFormulaObjects();
        LOG.info("Found {} root formula objects", roots.size());
        return walk(roots, source::relationshipSet);
    }

    /**
     * Walks the formula graph from the given roots.
     *
     * @param roots the root formula objects
     * @param relationshipSets looks up the relationships of an arc-role
     * @return the formula hierarchy of each root, keyed by root name
     */
    public Map<String, FormulaHierarchy> walk(
            final List<TaxonomyObject> roots,
            final Function<String, Optional<RelationshipSet>>
                    relationshipSets) {
        Preconditions.requireNonNull(roots, "Root objects are required");
        Preconditions.requireNonNull(relationshipSets,
                "Relationship lookup is required");

        final Map<String, FormulaHierarchy> formulas = new LinkedHashMap<>();

        for (final String arcRole : ArcRoles.FORMULA) {
            final Scope scope = Scope.of(arcRole);
            final Optional<RelationshipSet> relationshipSet =
                    relationshipSets.apply(arcRole);
            if (relationshipSet.isEmpty()) {
                listener.emptyScope(scope);
                continue;
            }

            for (final TaxonomyObject root : roots) {
                final FormulaHierarchy hierarchy = formulas.computeIfAbsent(
                        nameOf(root), k -> new FormulaHierarchy());
                visit(scope, relationshipSet.get(), root, hierarchy,
                        Collections.newSetFromMap(new IdentityHashMap<>()), 0);
            }
        }

        LOG.debug("Walked {} formula roots", formulas.size());
        return formulas;
    }

    private void visit(final Scope scope, final RelationshipSet relationships,
            final TaxonomyObject object, final FormulaHierarchy out,
            final Set<TaxonomyObject> path, final int depth) {

        final String name = nameOf(object);

        if (depth > maxDepth) {
            listener.depthExceeded(scope, name, depth);
            return;
        }
        if (path.contains(object)) {
            listener.cycleTruncated(scope, name);
            return;
        }

        path.add(object);
        final FormulaNode node = out.getOrCreate(name, object.localName(),
                object.xlinkLabel());

        for (final Relationship relationship
                : relationships.fromModelObject(object)) {
            final TaxonomyObject child = relationship.toModelObject();
            if (child == null) {
                continue;
            }
            final FormulaHierarchy childHierarchy = new FormulaHierarchy();
            visit(scope, relationships, child, childHierarchy, path,
                    depth + 1);
            node.addChild(childHierarchy);
        }

        path.remove(object);
    }

    private static String nameOf(final TaxonomyObject object) {
        final String label = object.xlinkLabel();
        return label != null ? label : object.localName();
    }

}
