package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.shared.Preconditions;

/**
 * Merges per-scope hierarchies into one unified hierarchy.
 *
 * <p>A root name seen for the first time is inserted as is. A root name
 * already present gets the incoming root's children appended to its own.
 * Children are not de-duplicated: a child contributed by two scopes
 * shows up twice.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class HierarchyMerger {

    private HierarchyMerger() {
    }

    /**
     * Merges a scope's hierarchy into the unified one.
     *
     * @param unified the hierarchy being accumulated, modified in place
     * @param scoped the hierarchy of one scope
     */
    public static void merge(final Hierarchy unified, final Hierarchy scoped) {
        Preconditions.requireNonNull(unified, "Unified hierarchy is required");
        Preconditions.requireNonNull(scoped, "Scoped hierarchy is required");

        for (final HierarchyNode root : scoped.roots().values()) {
            final HierarchyNode existing = unified.get(root.name());
            if (existing == null) {
                unified.put(root);
            } else {
                existing.appendChildren(root.children());
            }
        }
    }

}
