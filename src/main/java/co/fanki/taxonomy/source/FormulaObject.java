package co.fanki.taxonomy.source;

import co.fanki.taxonomy.shared.Preconditions;

import javax.xml.namespace.QName;

/**
 * A formula linkbase resource: an assertion, an assertion set, a
 * variable, a filter.
 *
 * <p>Formula resources are addressed by xlink label. They have no
 * qualified name of their own.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FormulaObject implements TaxonomyObject {

    private final String label;
    private final String type;

    /**
     * Creates a new formula object.
     *
     * @param theLabel the xlink label, may be null
     * @param theType the element local name, e.g. valueAssertion
     */
    public FormulaObject(final String theLabel, final String theType) {
        this.label = theLabel;
        this.type = Preconditions.requireNonBlank(theType,
                "Formula object type is required");
    }

    @Override
    public QName qname() {
        return null;
    }

    @Override
    public String xlinkLabel() {
        return label;
    }

    @Override
    public boolean isAbstract() {
        return false;
    }

    @Override
    public String localName() {
        return type;
    }

    @Override
    public String toString() {
        return label == null ? type : type + "#" + label;
    }

}
