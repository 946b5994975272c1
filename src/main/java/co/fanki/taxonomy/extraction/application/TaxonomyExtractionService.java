package co.fanki.taxonomy.extraction.application;

import co.fanki.taxonomy.concept.domain.ConceptCatalog;
import co.fanki.taxonomy.concept.domain.ConceptCatalog.ConceptSummary;
import co.fanki.taxonomy.formula.domain.FormulaGraphWalker;
import co.fanki.taxonomy.formula.domain.FormulaHierarchy;
import co.fanki.taxonomy.hierarchy.domain.Hierarchy;
import co.fanki.taxonomy.hierarchy.domain.ScopedHierarchyExtractor;
import co.fanki.taxonomy.shared.Preconditions;
import co.fanki.taxonomy.source.ArcRoles;
import co.fanki.taxonomy.source.TaxonomySource;
import co.fanki.taxonomy.source.TaxonomySourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Extracts concepts, presentation trees, dimensional hierarchies and
 * formula graphs from a taxonomy.
 *
 * <p>A taxonomy that fails to load aborts the extraction with the
 * loader's exception. Once loaded, every data quality problem is skipped
 * and the extraction returns whatever could be built.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class TaxonomyExtractionService {

    private static final Logger LOG = LoggerFactory.getLogger(
            TaxonomyExtractionService.class);

    private final TaxonomySourceLoader loader;
    private final ScopedHierarchyExtractor hierarchyExtractor;
    private final FormulaGraphWalker formulaGraphWalker;
    private final boolean presentationPerLinkRole;

    /**
     * Creates a new TaxonomyExtractionService.
     *
     * @param theLoader opens taxonomies
     * @param theHierarchyExtractor builds presentation and dimension
     *        hierarchies
     * @param theFormulaGraphWalker builds formula hierarchies
     * @param thePresentationPerLinkRole whether presentation trees are
     *        built per link role
     */
    public TaxonomyExtractionService(
            final TaxonomySourceLoader theLoader,
            final ScopedHierarchyExtractor theHierarchyExtractor,
            final FormulaGraphWalker theFormulaGraphWalker,
            @Value("${taxonomy.presentation.per-link-role:false}")
            final boolean thePresentationPerLinkRole) {
        this.loader = Preconditions.requireNonNull(theLoader,
                "Taxonomy loader is required");
        this.hierarchyExtractor = Preconditions.requireNonNull(
                theHierarchyExtractor, "Hierarchy extractor is required");
        this.formulaGraphWalker = Preconditions.requireNonNull(
                theFormulaGraphWalker, "Formula graph walker is required");
        this.presentationPerLinkRole = thePresentationPerLinkRole;
    }

    /**
     * Loads a taxonomy and extracts its metadata.
     *
     * @param location where the taxonomy lives
     * @return the extracted metadata
     * @throws co.fanki.taxonomy.source.TaxonomyLoadException if the
     *         taxonomy cannot be loaded
     */
    public TaxonomyMetadata extract(final String location) {
        Preconditions.requireNonBlank(location,
                "Taxonomy location is required");

        try (TaxonomySource source = loader.load(location)) {
            return extract(source);
        }
    }

    /**
     * Extracts the metadata of an already loaded taxonomy. The caller
     * keeps ownership of the source.
     *
     * @param source the taxonomy
     * @return the extracted metadata
     */
    public TaxonomyMetadata extract(final TaxonomySource source) {
        Preconditions.requireNonNull(source, "Taxonomy source is required");

        LOG.info("Extracting concepts");
        final Map<String, ConceptSummary> concepts =
                ConceptCatalog.of(source.concepts());

        LOG.info("Processing presentation relationships");
        final Hierarchy presentation = hierarchyExtractor.extract(source,
                List.of(ArcRoles.PARENT_CHILD), presentationPerLinkRole);

        LOG.info("Processing dimensions");
        final Hierarchy dimensions = hierarchyExtractor.extract(source,
                ArcRoles.DIMENSIONS, true);

        LOG.info("Processing formulas");
        final Map<String, FormulaHierarchy> formulas =
                formulaGraphWalker.walk(source);

        LOG.info("Extracted {} concepts, {} presentation top-level nodes,"
                        + " {} dimension parents, {} formulas",
                concepts.size(), presentation.size(), dimensions.size(),
                formulas.size());

        return new TaxonomyMetadata(concepts, presentation, dimensions,
                formulas);
    }

}
