package co.fanki.taxonomy.source;

import java.util.List;
import java.util.Set;

/**
 * The relationships of one arc-role, optionally narrowed to one extended
 * link role.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface RelationshipSet {

    /**
     * Returns the relationships in document order.
     *
     * @return the relationships, never null
     */
    List<Relationship> modelRelationships();

    /**
     * Returns the link roles the relationships of this set live in, in
     * the order they first appear.
     *
     * @return the link role URIs, never null
     */
    Set<String> linkRoleUris();

    /**
     * Returns the relationships whose source is the given object.
     *
     * @param object the source object
     * @return the outgoing relationships in document order, never null
     */
    List<Relationship> fromModelObject(TaxonomyObject object);

}
