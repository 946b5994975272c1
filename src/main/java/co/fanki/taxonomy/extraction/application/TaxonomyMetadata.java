package co.fanki.taxonomy.extraction.application;

import co.fanki.taxonomy.concept.domain.ConceptCatalog.ConceptSummary;
import co.fanki.taxonomy.formula.domain.FormulaHierarchy;
import co.fanki.taxonomy.hierarchy.domain.Hierarchy;

import java.util.Map;

/**
 * Everything extracted from one taxonomy, handed to the presentation
 * layer.
 *
 * @param concepts concept summaries keyed by prefixed name
 * @param presentationRelationships the presentation forest
 * @param dimensions the unified dimensional forest
 * @param formulas formula hierarchies keyed by root name
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TaxonomyMetadata(
        Map<String, ConceptSummary> concepts,
        Hierarchy presentationRelationships,
        Hierarchy dimensions,
        Map<String, FormulaHierarchy> formulas) {
}
