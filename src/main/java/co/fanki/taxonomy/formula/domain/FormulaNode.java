package co.fanki.taxonomy.formula.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A formula resource in a formula graph.
 *
 * <p>Every outgoing arc contributes one child {@link FormulaHierarchy}.
 * A child hierarchy is empty when its target was cut by the cycle or
 * depth guard.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"type", "label", "children"})
public final class FormulaNode {

    private final String type;
    private final String label;
    private final List<FormulaHierarchy> children = new ArrayList<>();

    FormulaNode(final String theType, final String theLabel) {
        this.type = theType;
        this.label = theLabel;
    }

    /**
     * Returns the element type, e.g. valueAssertion.
     *
     * @return the type
     */
    @JsonProperty("type")
    public String type() {
        return type;
    }

    /**
     * Returns the xlink label.
     *
     * @return the label, or null if the resource has none
     */
    @JsonProperty("label")
    public String label() {
        return label;
    }

    @JsonProperty("children")
    public List<FormulaHierarchy> children() {
        return Collections.unmodifiableList(children);
    }

    void addChild(final FormulaHierarchy child) {
        children.add(child);
    }

}
