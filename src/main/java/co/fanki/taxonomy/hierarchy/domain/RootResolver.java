package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.shared.Preconditions;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Finds the roots of the forest described by a {@link ParentChildMap}.
 *
 * <p>A root is a node that never appears as someone's child. When every
 * node is somebody's child (a pure cycle) every node is returned, so a
 * non-empty map never yields an empty forest. In that case the forest
 * shows the same nodes under several roots.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RootResolver {

    private RootResolver() {
    }

    /**
     * Resolves the root names, in map order.
     *
     * @param map the adjacency map of one scope
     * @return the root names, empty only if the map is empty
     */
    public static Set<String> resolve(final ParentChildMap map) {
        Preconditions.requireNonNull(map, "Parent-child map is required");

        final Set<String> children = map.childNames();
        final Set<String> roots = new LinkedHashSet<>(map.names());
        roots.removeAll(children);

        if (roots.isEmpty()) {
            return new LinkedHashSet<>(map.names());
        }
        return roots;
    }

}
