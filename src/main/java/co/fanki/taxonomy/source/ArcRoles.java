package co.fanki.taxonomy.source;

import java.util.List;

/**
 * Arc-role URIs the extraction reads.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ArcRoles {

    /** Presentation linkbase parent-child arcs. */
    public static final String PARENT_CHILD =
            "http://www.xbrl.org/2003/arcrole/parent-child";

    public static final String HYPERCUBE_DIMENSION =
            "http://xbrl.org/int/dim/arcrole/hypercube-dimension";

    public static final String DIMENSION_DOMAIN =
            "http://xbrl.org/int/dim/arcrole/dimension-domain";

    public static final String DOMAIN_MEMBER =
            "http://xbrl.org/int/dim/arcrole/domain-member";

    public static final String ASSERTION_SET =
            "http://xbrl.org/arcrole/2008/assertion-set";

    public static final String VARIABLE_SET =
            "http://xbrl.org/arcrole/2008/variable-set";

    public static final String VARIABLE_SET_FILTER =
            "http://xbrl.org/arcrole/2008/variable-set-filter";

    /** Dimensional arc-roles, in merge order. */
    public static final List<String> DIMENSIONS = List.of(
            HYPERCUBE_DIMENSION, DIMENSION_DOMAIN, DOMAIN_MEMBER);

    /** Formula arc-roles, in traversal order. */
    public static final List<String> FORMULA = List.of(
            ASSERTION_SET, VARIABLE_SET, VARIABLE_SET_FILTER);

    private ArcRoles() {
    }

}
