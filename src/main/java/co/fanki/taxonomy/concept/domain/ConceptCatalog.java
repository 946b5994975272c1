package co.fanki.taxonomy.concept.domain;

import co.fanki.taxonomy.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summaries of the concepts of a taxonomy, keyed by prefixed name.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConceptCatalog {

    /**
     * What the presentation layer shows for one concept.
     *
     * @param name the local name
     * @param type the item type local name, may be null
     * @param substitutionGroup the substitution group local name,
     *        may be null
     * @param periodType instant or duration, may be null
     * @param balance debit or credit, may be null
     * @param isAbstract whether the concept is abstract
     */
    public record ConceptSummary(
            String name,
            String type,
            String substitutionGroup,
            String periodType,
            String balance,
            @JsonProperty("abstract") boolean isAbstract) {}

    private ConceptCatalog() {
    }

    /**
     * Summarizes the given concepts. A later concept with the same
     * prefixed name replaces an earlier one.
     *
     * @param concepts the concepts in definition order
     * @return the summaries keyed by prefixed name, in definition order
     */
    public static Map<String, ConceptSummary> of(
            final List<Concept> concepts) {
        Preconditions.requireNonNull(concepts, "Concepts are required");

        final Map<String, ConceptSummary> catalog = new LinkedHashMap<>();
        for (final Concept concept : concepts) {
            catalog.put(concept.prefixedName(), new ConceptSummary(
                    concept.localName(),
                    concept.type(),
                    concept.substitutionGroup(),
                    concept.periodType(),
                    concept.balance(),
                    concept.isAbstract()));
        }
        return Collections.unmodifiableMap(catalog);
    }

}
