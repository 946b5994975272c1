package co.fanki.taxonomy.hierarchy.domain;

/**
 * Receives the data quality events raised while hierarchies are built.
 *
 * <p>None of these events stop the extraction; they describe what was
 * left out of the result. All methods default to doing nothing.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface HierarchyListener {

    /** A listener that ignores every event. */
    HierarchyListener NONE = new HierarchyListener() { };

    /**
     * A relationship was dropped by the edge collector.
     *
     * @param scope the scope being collected
     * @param skipped the dropped relationship and the reason
     */
    default void edgeSkipped(final Scope scope,
            final SkippedRelationship skipped) {
    }

    /**
     * A node was reached again along its own descent path and was not
     * expanded at that occurrence.
     *
     * @param scope the scope being built
     * @param name the name of the node closing the cycle
     */
    default void cycleTruncated(final Scope scope, final String name) {
    }

    /**
     * A traversal went past its maximum depth and stopped descending.
     *
     * @param scope the scope being walked
     * @param name the name of the node that was not visited
     * @param depth the depth the node was reached at
     */
    default void depthExceeded(final Scope scope, final String name,
            final int depth) {
    }

    /**
     * A scope had no relationships at all.
     *
     * @param scope the empty scope
     */
    default void emptyScope(final Scope scope) {
    }

}
