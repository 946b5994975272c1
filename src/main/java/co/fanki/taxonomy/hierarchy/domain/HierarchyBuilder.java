package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.shared.Preconditions;
import co.fanki.taxonomy.source.TaxonomyObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the hierarchy of one scope from its edges.
 *
 * <p>Building happens in two steps. {@link #map(Scope, List)} folds the
 * edges into a {@link ParentChildMap}; {@link #build(Scope, ParentChildMap,
 * Collection)} then materializes one tree per root by depth-first descent.
 * The descent keeps the names of the current path only: a node may be
 * expanded again under another branch, but never under itself. A node
 * found on its own path contributes nothing at that occurrence.</p>
 *
 * <p>Node names are the local part of the concept's qualified name. In a
 * link role specific scope parent names carry the scope's tag, e.g.
 * {@code [Balance] Assets}, while child names stay bare.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class HierarchyBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            HierarchyBuilder.class);

    private final HierarchyListener listener;

    /**
     * Creates a new HierarchyBuilder.
     *
     * @param theListener receives cycle truncation events
     */
    public HierarchyBuilder(final HierarchyListener theListener) {
        this.listener = Preconditions.requireNonNull(theListener,
                "Hierarchy listener is required");
    }

    /**
     * Folds the edges of a scope into an adjacency map.
     *
     * @param scope the scope the edges belong to
     * @param edges the edges in document order
     * @return the adjacency map
     */
    public ParentChildMap map(final Scope scope, final List<Edge> edges) {
        Preconditions.requireNonNull(scope, "Scope is required");
        Preconditions.requireNonNull(edges, "Edges are required");

        final ParentChildMap map = new ParentChildMap();
        for (final Edge edge : edges) {
            map.link(
                    parentName(scope, edge.from()), edge.from().isAbstract(),
                    childName(edge.to()), edge.to().isAbstract());
        }

        if (LOG.isTraceEnabled()) {
            for (final String name : map.names()) {
                LOG.trace("{} -> {}", name, map.get(name).children());
            }
        }
        return map;
    }

    /**
     * Materializes one tree per root name.
     *
     * <p>A root that is not in the map becomes a leaf.</p>
     *
     * @param scope the scope being built, used for reporting
     * @param map the adjacency map of the scope
     * @param rootNames the roots, in output order
     * @return the forest
     */
    public Hierarchy build(final Scope scope, final ParentChildMap map,
            final Collection<String> rootNames) {
        Preconditions.requireNonNull(map, "Parent-child map is required");
        Preconditions.requireNonNull(rootNames, "Root names are required");

        final Hierarchy hierarchy = new Hierarchy();
        for (final String rootName : rootNames) {
            final HierarchyNode root = materialize(scope, map, rootName,
                    new HashSet<>());
            if (root != null) {
                hierarchy.put(root);
            }
        }
        return hierarchy;
    }

    private HierarchyNode materialize(final Scope scope,
            final ParentChildMap map, final String name,
            final Set<String> path) {

        if (!path.add(name)) {
            listener.cycleTruncated(scope, name);
            return null;
        }

        final ParentChildMap.Entry entry = map.get(name);
        final HierarchyNode node = new HierarchyNode(name,
                entry != null && entry.isAbstract());

        if (entry != null) {
            for (final String childName : entry.children()) {
                final HierarchyNode child = materialize(scope, map,
                        childName, path);
                if (child != null) {
                    node.addChild(child);
                }
            }
        }

        path.remove(name);
        return node;
    }

    /**
     * Returns the name a parent object takes in a scope.
     *
     * @param scope the scope
     * @param parent the parent object, with a qualified name
     * @return the tagged parent name
     */
    static String parentName(final Scope scope, final TaxonomyObject parent) {
        return scope.parentTag() + parent.qname().getLocalPart();
    }

    /**
     * Returns the name a child object takes in any scope.
     *
     * @param child the child object, with a qualified name
     * @return the bare child name
     */
    static String childName(final TaxonomyObject child) {
        return child.qname().getLocalPart();
    }

}
