package co.fanki.taxonomy.source;

import co.fanki.taxonomy.concept.domain.Concept;
import co.fanki.taxonomy.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.xml.namespace.QName;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads a taxonomy from a JSON relationship dump exported by an XBRL
 * processor.
 *
 * <p>The document has three arrays: {@code concepts},
 * {@code formulaObjects} and {@code relationships}. Relationship
 * endpoints reference concepts by prefixed name and formula resources by
 * label. A reference that resolves to nothing becomes a missing endpoint,
 * which the hierarchy builders skip.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class JsonTaxonomySourceLoader implements TaxonomySourceLoader {

    private static final Logger LOG = LoggerFactory.getLogger(
            JsonTaxonomySourceLoader.class);

    /** The link role arcs fall in when the dump does not name one. */
    static final String DEFAULT_LINK_ROLE =
            "http://www.xbrl.org/2003/role/link";

    private final ObjectMapper objectMapper;

    /**
     * Creates a new loader.
     *
     * @param theObjectMapper the mapper used to read the dump
     */
    public JsonTaxonomySourceLoader(final ObjectMapper theObjectMapper) {
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
    }

    @Override
    public TaxonomySource load(final String location) {
        Preconditions.requireNonBlank(location,
                "Taxonomy location is required");

        final Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new TaxonomyLoadException(
                    "Failed to load taxonomy: " + location
                            + " is not a readable file");
        }

        LOG.info("Loading taxonomy from {}", path);

        final JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (final IOException e) {
            throw new TaxonomyLoadException(
                    "Failed to load taxonomy: " + location, e);
        }
        if (root == null || !root.isObject()) {
            throw new TaxonomyLoadException("Failed to load taxonomy: "
                    + location + " does not hold a JSON object");
        }

        final InMemoryTaxonomySource.Builder builder =
                InMemoryTaxonomySource.builder();
        final Map<String, TaxonomyObject> byReference = new HashMap<>();

        for (final JsonNode node : root.path("concepts")) {
            final Concept concept = readConcept(node, location);
            builder.concept(concept);
            byReference.put(concept.prefixedName(), concept);
        }

        for (final JsonNode node : root.path("formulaObjects")) {
            final FormulaObject formulaObject = readFormulaObject(node,
                    location);
            builder.formulaObject(formulaObject);
            if (formulaObject.xlinkLabel() != null) {
                byReference.put(formulaObject.xlinkLabel(), formulaObject);
            }
        }

        int relationshipCount = 0;
        for (final JsonNode node : root.path("relationships")) {
            final String arcRole = text(node, "arcRole");
            if (arcRole == null) {
                throw new TaxonomyLoadException("Failed to load taxonomy: "
                        + location + " has a relationship without arcRole");
            }
            final String linkRole = text(node, "linkRole");
            builder.relationship(
                    byReference.get(text(node, "from")),
                    byReference.get(text(node, "to")),
                    arcRole,
                    linkRole == null ? DEFAULT_LINK_ROLE : linkRole);
            relationshipCount++;
        }

        final InMemoryTaxonomySource source = builder.build();
        LOG.info("Loaded taxonomy {} ({} concepts, {} relationships)",
                path.getFileName(), source.concepts().size(),
                relationshipCount);
        return source;
    }

    private Concept readConcept(final JsonNode node, final String location) {
        final String name = text(node, "name");
        if (name == null) {
            throw new TaxonomyLoadException("Failed to load taxonomy: "
                    + location + " has a concept without name");
        }
        final String namespace = text(node, "namespace");
        final String prefix = text(node, "prefix");
        final QName qname = new QName(
                namespace == null ? "" : namespace,
                name,
                prefix == null ? "" : prefix);
        return new Concept(qname,
                text(node, "type"),
                text(node, "substitutionGroup"),
                text(node, "periodType"),
                text(node, "balance"),
                node.path("abstract").asBoolean(false));
    }

    private FormulaObject readFormulaObject(final JsonNode node,
            final String location) {
        final String type = text(node, "type");
        if (type == null) {
            throw new TaxonomyLoadException("Failed to load taxonomy: "
                    + location + " has a formula object without type");
        }
        return new FormulaObject(text(node, "label"), type);
    }

    private static String text(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        final String text = value.asText();
        return text.isBlank() ? null : text;
    }

}
