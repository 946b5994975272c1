package co.fanki.taxonomy.formula.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Formula nodes keyed by name (label, or type when unlabelled), in
 * insertion order.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FormulaHierarchy {

    private final Map<String, FormulaNode> nodes = new LinkedHashMap<>();

    /**
     * Returns the node with the given name.
     *
     * @param name the node name
     * @return the node, or null if there is none
     */
    public FormulaNode get(final String name) {
        return nodes.get(name);
    }

    @JsonValue
    public Map<String, FormulaNode> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    FormulaNode getOrCreate(final String name, final String type,
            final String label) {
        return nodes.computeIfAbsent(name, k -> new FormulaNode(type, label));
    }

}
