package co.fanki.taxonomy.source;

import co.fanki.taxonomy.concept.domain.Concept;

import java.util.List;
import java.util.Optional;

/**
 * A loaded taxonomy, queried by arc-role and link role.
 *
 * <p>Obtained from a {@link TaxonomySourceLoader}. Holding an instance
 * means the taxonomy loaded; everything read from it afterwards is best
 * effort.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface TaxonomySource extends AutoCloseable {

    /**
     * Returns every relationship of an arc-role across all link roles.
     *
     * @param arcRole the arc-role URI
     * @return the relationship set, empty if the taxonomy has no arc
     *         with that role
     */
    Optional<RelationshipSet> relationshipSet(String arcRole);

    /**
     * Returns the relationships of an arc-role inside one link role.
     *
     * @param arcRole the arc-role URI
     * @param linkRole the extended link role URI
     * @return the relationship set, empty if there is none
     */
    Optional<RelationshipSet> relationshipSet(String arcRole,
            String linkRole);

    /**
     * Returns the concepts defined by the taxonomy.
     *
     * @return the concepts in definition order
     */
    List<Concept> concepts();

    /**
     * Returns the formula objects with no incoming formula arc.
     *
     * @return the root formula objects
     */
    List<TaxonomyObject> rootFormulaObjects();

    /** Releases the resources held by the taxonomy. */
    @Override
    void close();

}
