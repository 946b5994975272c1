package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An ordered forest of relationship trees keyed by root name.
 *
 * <p>Root order is insertion order and drives display order.
 * Serializes to a JSON object of root name to node.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Hierarchy {

    private final Map<String, HierarchyNode> roots = new LinkedHashMap<>();

    /**
     * Returns the root with the given name.
     *
     * @param name the root name
     * @return the root node, or null if there is none
     */
    public HierarchyNode get(final String name) {
        return roots.get(name);
    }

    public boolean contains(final String name) {
        return roots.containsKey(name);
    }

    /**
     * Returns the roots keyed by name, in insertion order.
     *
     * @return an unmodifiable view of the roots
     */
    @JsonValue
    public Map<String, HierarchyNode> roots() {
        return Collections.unmodifiableMap(roots);
    }

    public Set<String> rootNames() {
        return Collections.unmodifiableSet(roots.keySet());
    }

    public int size() {
        return roots.size();
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }

    void put(final HierarchyNode root) {
        Preconditions.requireNonNull(root, "Root node is required");
        roots.put(root.name(), root);
    }

}
