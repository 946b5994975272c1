package co.fanki.taxonomy.source;

/**
 * A raw arc between two taxonomy objects, as reported by the taxonomy
 * engine.
 *
 * <p>Either endpoint may be absent when the engine could not resolve
 * the locator the arc points to.</p>
 *
 * @param fromModelObject the source object, may be null
 * @param toModelObject the target object, may be null
 * @param arcRole the arc-role URI
 * @param linkRole the extended link role URI the arc lives in
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Relationship(
        TaxonomyObject fromModelObject,
        TaxonomyObject toModelObject,
        String arcRole,
        String linkRole) {
}
