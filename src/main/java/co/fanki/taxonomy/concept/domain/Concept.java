package co.fanki.taxonomy.concept.domain;

import co.fanki.taxonomy.shared.Preconditions;
import co.fanki.taxonomy.source.TaxonomyObject;

import javax.xml.namespace.QName;

/**
 * A concept declared by a taxonomy schema.
 *
 * <p>Type, substitution group, period type and balance are optional:
 * tuples carry no period type, non-monetary items carry no balance.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Concept implements TaxonomyObject {

    private final QName qname;
    private final String type;
    private final String substitutionGroup;
    private final String periodType;
    private final String balance;
    private final boolean abstractConcept;

    /**
     * Creates a new concept.
     *
     * @param theQname the qualified name, required
     * @param theType the local name of the item type, may be null
     * @param theSubstitutionGroup the local name of the substitution
     *        group, may be null
     * @param thePeriodType instant or duration, may be null
     * @param theBalance debit or credit, may be null
     * @param isAbstract whether the concept is abstract
     */
    public Concept(final QName theQname, final String theType,
            final String theSubstitutionGroup, final String thePeriodType,
            final String theBalance, final boolean isAbstract) {
        this.qname = Preconditions.requireNonNull(theQname,
                "Concept qualified name is required");
        this.type = theType;
        this.substitutionGroup = theSubstitutionGroup;
        this.periodType = thePeriodType;
        this.balance = theBalance;
        this.abstractConcept = isAbstract;
    }

    @Override
    public QName qname() {
        return qname;
    }

    /** Concepts are not addressed by xlink label. */
    @Override
    public String xlinkLabel() {
        return null;
    }

    @Override
    public boolean isAbstract() {
        return abstractConcept;
    }

    @Override
    public String localName() {
        return qname.getLocalPart();
    }

    /**
     * Returns the name in prefix:localName form, or the bare local name
     * when the qualified name has no prefix.
     *
     * @return the prefixed name
     */
    public String prefixedName() {
        final String prefix = qname.getPrefix();
        if (prefix == null || prefix.isEmpty()) {
            return qname.getLocalPart();
        }
        return prefix + ":" + qname.getLocalPart();
    }

    public String type() {
        return type;
    }

    public String substitutionGroup() {
        return substitutionGroup;
    }

    public String periodType() {
        return periodType;
    }

    public String balance() {
        return balance;
    }

    @Override
    public String toString() {
        return prefixedName();
    }

}
