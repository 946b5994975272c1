package co.fanki.taxonomy.source;

import co.fanki.taxonomy.concept.domain.Concept;
import co.fanki.taxonomy.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Taxonomy held entirely in memory: concepts, formula resources and the
 * arcs between them.
 *
 * <p>Built either by {@link JsonTaxonomySourceLoader} from a relationship
 * dump or directly through {@link #builder()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class InMemoryTaxonomySource implements TaxonomySource {

    private final List<Concept> concepts;
    private final List<FormulaObject> formulaObjects;
    private final List<Relationship> relationships;

    private InMemoryTaxonomySource(final Builder builder) {
        this.concepts = List.copyOf(builder.concepts);
        this.formulaObjects = List.copyOf(builder.formulaObjects);
        this.relationships = Collections.unmodifiableList(
                new ArrayList<>(builder.relationships));
    }

    /**
     * Creates a builder for an in-memory taxonomy.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<RelationshipSet> relationshipSet(final String arcRole) {
        Preconditions.requireNonBlank(arcRole, "Arc-role is required");
        return select(r -> arcRole.equals(r.arcRole()));
    }

    @Override
    public Optional<RelationshipSet> relationshipSet(final String arcRole,
            final String linkRole) {
        Preconditions.requireNonBlank(arcRole, "Arc-role is required");
        Preconditions.requireNonBlank(linkRole, "Link role is required");
        return select(r -> arcRole.equals(r.arcRole())
                && linkRole.equals(r.linkRole()));
    }

    @Override
    public List<Concept> concepts() {
        return concepts;
    }

    /**
     * Returns the formula resources that no formula arc points to, in
     * registration order.
     *
     * @return the root formula objects
     */
    @Override
    public List<TaxonomyObject> rootFormulaObjects() {
        final Set<TaxonomyObject> targets = new HashSet<>();
        for (final Relationship relationship : relationships) {
            if (ArcRoles.FORMULA.contains(relationship.arcRole())
                    && relationship.toModelObject() != null) {
                targets.add(relationship.toModelObject());
            }
        }
        final List<TaxonomyObject> roots = new ArrayList<>();
        for (final FormulaObject object : formulaObjects) {
            if (!targets.contains(object)) {
                roots.add(object);
            }
        }
        return roots;
    }

    /** Nothing to release, the taxonomy lives on the heap. */
    @Override
    public void close() {
    }

    private Optional<RelationshipSet> select(
            final Predicate<Relationship> filter) {
        final List<Relationship> selected = relationships.stream()
                .filter(filter)
                .toList();
        if (selected.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ListRelationshipSet(selected));
    }

    /** A relationship set backed by an already filtered list. */
    private static final class ListRelationshipSet
            implements RelationshipSet {

        private final List<Relationship> relationships;

        private ListRelationshipSet(final List<Relationship> theRelationships) {
            this.relationships = theRelationships;
        }

        @Override
        public List<Relationship> modelRelationships() {
            return relationships;
        }

        @Override
        public Set<String> linkRoleUris() {
            final Set<String> linkRoles = new LinkedHashSet<>();
            for (final Relationship relationship : relationships) {
                if (relationship.linkRole() != null) {
                    linkRoles.add(relationship.linkRole());
                }
            }
            return Collections.unmodifiableSet(linkRoles);
        }

        @Override
        public List<Relationship> fromModelObject(final TaxonomyObject object) {
            return relationships.stream()
                    .filter(r -> r.fromModelObject() != null
                            && Objects.equals(r.fromModelObject(), object))
                    .toList();
        }
    }

    /**
     * Collects the content of an in-memory taxonomy.
     */
    public static final class Builder {

        private final List<Concept> concepts = new ArrayList<>();
        private final List<FormulaObject> formulaObjects = new ArrayList<>();
        private final List<Relationship> relationships = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a concept.
         *
         * @param concept the concept, required
         * @return this builder
         */
        public Builder concept(final Concept concept) {
            concepts.add(Preconditions.requireNonNull(concept,
                    "Concept is required"));
            return this;
        }

        /**
         * Adds a formula resource.
         *
         * @param formulaObject the formula resource, required
         * @return this builder
         */
        public Builder formulaObject(final FormulaObject formulaObject) {
            formulaObjects.add(Preconditions.requireNonNull(formulaObject,
                    "Formula object is required"));
            return this;
        }

        /**
         * Adds an arc. Endpoints may be null to model arcs whose locator
         * did not resolve.
         *
         * @param from the source object, may be null
         * @param to the target object, may be null
         * @param arcRole the arc-role URI, required
         * @param linkRole the link role URI, required
         * @return this builder
         */
        public Builder relationship(final TaxonomyObject from,
                final TaxonomyObject to, final String arcRole,
                final String linkRole) {
            Preconditions.requireNonBlank(arcRole, "Arc-role is required");
            Preconditions.requireNonBlank(linkRole, "Link role is required");
            relationships.add(new Relationship(from, to, arcRole, linkRole));
            return this;
        }

        /**
         * Builds the taxonomy.
         *
         * @return the in-memory taxonomy
         */
        public InMemoryTaxonomySource build() {
            return new InMemoryTaxonomySource(this);
        }
    }

}
