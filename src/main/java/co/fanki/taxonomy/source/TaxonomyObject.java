package co.fanki.taxonomy.source;

import javax.xml.namespace.QName;

/**
 * An object owned by the taxonomy engine: a concept, an assertion, a
 * variable set, a filter.
 *
 * <p>The hierarchy and formula builders only rely on identity, the
 * abstract flag and the display name. Anything richer stays behind the
 * implementation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface TaxonomyObject {

    /**
     * Returns the qualified name identifying this object.
     *
     * @return the qualified name, or null if the object has none
     */
    QName qname();

    /**
     * Returns the xlink label of this object inside its linkbase.
     *
     * @return the label, or null if the object has none
     */
    String xlinkLabel();

    /**
     * Whether this object only groups other objects.
     *
     * @return true for abstract concepts
     */
    boolean isAbstract();

    /**
     * Returns the display name: the concept local name, or the element
     * type for formula objects (e.g. valueAssertion).
     *
     * @return the local name, never null
     */
    String localName();

}
