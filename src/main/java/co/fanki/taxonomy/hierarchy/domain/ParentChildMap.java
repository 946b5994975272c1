package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Working adjacency map of one scope: node name to abstract flag,
 * ordered child names and last known parent.
 *
 * <p>Entries are created on first reference and keep insertion order,
 * which is the order nodes are displayed in. The map is discarded once
 * the scope's hierarchy has been materialized.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ParentChildMap {

    /** The adjacency entry of one node. */
    public static final class Entry {

        private final boolean abstractNode;
        private final Set<String> children = new LinkedHashSet<>();
        private String parent;

        private Entry(final boolean isAbstract) {
            this.abstractNode = isAbstract;
        }

        public boolean isAbstract() {
            return abstractNode;
        }

        /**
         * Returns the child names in first-seen order.
         *
         * @return the child names, never null
         */
        public Set<String> children() {
            return Collections.unmodifiableSet(children);
        }

        /**
         * Returns the parent this node was last linked under.
         *
         * @return the parent name, or null if the node is only a parent
         */
        public String parent() {
            return parent;
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * Returns the entry for a name, creating it when missing.
     *
     * <p>The abstract flag is only recorded when the entry is created.</p>
     *
     * @param name the node name
     * @param isAbstract the abstract flag for a new entry
     * @return the existing or created entry
     */
    public Entry getOrCreate(final String name, final boolean isAbstract) {
        Preconditions.requireNonNull(name, "Node name is required");
        return entries.computeIfAbsent(name, k -> new Entry(isAbstract));
    }

    /**
     * Links a child under a parent, creating both entries on first
     * reference. Linking the same pair again has no effect on the
     * child order.
     *
     * @param parentName the parent node name
     * @param parentAbstract whether the parent is abstract
     * @param childName the child node name
     * @param childAbstract whether the child is abstract
     */
    public void link(final String parentName, final boolean parentAbstract,
            final String childName, final boolean childAbstract) {
        final Entry parentEntry = getOrCreate(parentName, parentAbstract);
        final Entry childEntry = getOrCreate(childName, childAbstract);
        childEntry.parent = parentName;
        parentEntry.children.add(childName);
    }

    /**
     * Returns the entry for a name.
     *
     * @param name the node name
     * @return the entry, or null if the name was never referenced
     */
    public Entry get(final String name) {
        return entries.get(name);
    }

    /**
     * Returns every node name in first-seen order.
     *
     * @return the node names
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * Returns the union of every node's children.
     *
     * @return the names that appear as a child at least once
     */
    public Set<String> childNames() {
        final Set<String> result = new LinkedHashSet<>();
        for (final Entry entry : entries.values()) {
            result.addAll(entry.children);
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

}
