package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.source.TaxonomyObject;

/**
 * A validated arc: both endpoints are present and carry a qualified name.
 *
 * @param from the parent object
 * @param to the child object
 * @param scope the scope the arc was read from
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Edge(TaxonomyObject from, TaxonomyObject to, Scope scope) {
}
