package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named node of a relationship hierarchy with its ordered children.
 *
 * <p>The same name may appear under several parents when the taxonomy
 * has fan-in. Children are only appended while scopes are merged; the
 * tree is read-only afterwards.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"name", "abstract", "children"})
public final class HierarchyNode {

    private final String name;
    private final boolean abstractNode;
    private final List<HierarchyNode> children = new ArrayList<>();

    HierarchyNode(final String theName, final boolean isAbstract) {
        this.name = Preconditions.requireNonNull(theName,
                "Node name is required");
        this.abstractNode = isAbstract;
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("abstract")
    public boolean isAbstract() {
        return abstractNode;
    }

    @JsonProperty("children")
    public List<HierarchyNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the names of the direct children, in order.
     *
     * @return the child names, duplicates included
     */
    public List<String> childNames() {
        return children.stream().map(HierarchyNode::name).toList();
    }

    /**
     * Returns the first direct child with the given name.
     *
     * @param childName the child name
     * @return the child, or null if there is none
     */
    public HierarchyNode child(final String childName) {
        for (final HierarchyNode child : children) {
            if (child.name.equals(childName)) {
                return child;
            }
        }
        return null;
    }

    void addChild(final HierarchyNode child) {
        children.add(child);
    }

    void appendChildren(final List<HierarchyNode> others) {
        children.addAll(others);
    }

    @Override
    public String toString() {
        return name;
    }

}
