package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.source.TaxonomyObject;

/**
 * A relationship left out of a hierarchy, with the reason why.
 *
 * @param from the source object, may be null
 * @param to the target object, may be null
 * @param reason why the relationship was left out
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SkippedRelationship(
        TaxonomyObject from,
        TaxonomyObject to,
        Reason reason) {

    /** Why a relationship did not make it into the hierarchy. */
    public enum Reason {

        /** The source or the target could not be resolved. */
        MISSING_ENDPOINT,

        /** An endpoint exists but has no qualified name. */
        MISSING_IDENTITY
    }
}
