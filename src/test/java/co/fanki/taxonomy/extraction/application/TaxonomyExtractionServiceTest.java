package co.fanki.taxonomy.extraction.application;

import co.fanki.taxonomy.formula.domain.FormulaGraphWalker;
import co.fanki.taxonomy.formula.domain.FormulaNode;
import co.fanki.taxonomy.hierarchy.domain.Hierarchy;
import co.fanki.taxonomy.hierarchy.domain.HierarchyNode;
import co.fanki.taxonomy.hierarchy.domain.RecordingHierarchyListener;
import co.fanki.taxonomy.hierarchy.domain.ScopedHierarchyExtractor;
import co.fanki.taxonomy.source.JsonTaxonomySourceLoader;
import co.fanki.taxonomy.source.TaxonomyLoadException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TaxonomyExtractionService} over the sample
 * taxonomy dump.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TaxonomyExtractionServiceTest {

    private ObjectMapper objectMapper;
    private RecordingHierarchyListener listener;
    private TaxonomyExtractionService service;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        listener = new RecordingHierarchyListener();
        service = new TaxonomyExtractionService(
                new JsonTaxonomySourceLoader(objectMapper),
                new ScopedHierarchyExtractor(listener),
                new FormulaGraphWalker(FormulaGraphWalker.DEFAULT_MAX_DEPTH,
                        listener),
                false);
    }

    @Test
    void whenExtracting_givenSampleTaxonomy_shouldCatalogAllConcepts()
            throws Exception {
        final TaxonomyMetadata metadata = service.extract(sampleLocation());

        assertEquals(10, metadata.concepts().size());
        assertTrue(metadata.concepts().get("us-gaap:BalanceSheetAbstract")
                .isAbstract());
        assertEquals("credit",
                metadata.concepts().get("us-gaap:Liabilities").balance());
    }

    @Test
    void whenExtracting_givenSampleTaxonomy_shouldBuildPresentationTree()
            throws Exception {
        final Hierarchy presentation = service.extract(sampleLocation())
                .presentationRelationships();

        assertEquals(List.of("BalanceSheetAbstract"),
                List.copyOf(presentation.rootNames()));
        final HierarchyNode root = presentation.get("BalanceSheetAbstract");
        assertTrue(root.isAbstract());
        assertEquals(List.of("Assets", "Liabilities"), root.childNames());
        assertEquals(List.of("Cash", "Receivables"),
                root.child("Assets").childNames());
        assertEquals(1, listener.skipped.size());
    }

    @Test
    void whenExtracting_givenSampleTaxonomy_shouldTagDimensionParents()
            throws Exception {
        final Hierarchy dimensions = service.extract(sampleLocation())
                .dimensions();

        assertEquals(List.of("[Segments] SegmentsTable",
                        "[Segments] SegmentAxis", "[Segments] SegmentDomain"),
                List.copyOf(dimensions.rootNames()));
        assertEquals(List.of("SegmentAxis"),
                dimensions.get("[Segments] SegmentsTable").childNames());
        assertEquals(List.of("RetailMember", "WholesaleMember"),
                dimensions.get("[Segments] SegmentDomain").childNames());
    }

    @Test
    void whenExtracting_givenSampleTaxonomy_shouldWalkFormulaRoots()
            throws Exception {
        final TaxonomyMetadata metadata = service.extract(sampleLocation());

        assertEquals(List.of("assertionSet1", "valueAssertion2"),
                List.copyOf(metadata.formulas().keySet()));
        final FormulaNode set = metadata.formulas().get("assertionSet1")
                .get("assertionSet1");
        assertEquals(1, set.children().size());
        assertEquals("valueAssertion",
                set.children().get(0).get("valueAssertion1").type());
        final FormulaNode assertion = metadata.formulas()
                .get("valueAssertion2").get("valueAssertion2");
        assertEquals(2, assertion.children().size());
        assertEquals("conceptName", assertion.children().get(1)
                .get("conceptFilter2").type());
    }

    @Test
    void whenSerializing_givenExtractedMetadata_shouldRenderNestedJson()
            throws Exception {
        final TaxonomyMetadata metadata = service.extract(sampleLocation());

        final JsonNode json = objectMapper.valueToTree(metadata);

        final JsonNode root = json.get("presentationRelationships")
                .get("BalanceSheetAbstract");
        assertTrue(root.get("abstract").asBoolean());
        assertEquals("Assets", root.get("children").get(0).get("name")
                .asText());
        assertFalse(json.get("formulas").get("assertionSet1").isEmpty());
    }

    @Test
    void whenExtracting_givenMissingTaxonomy_shouldPropagateLoadException() {
        assertThrows(TaxonomyLoadException.class,
                () -> service.extract("/no/such/taxonomy.json"));
    }

    @Test
    void whenExtracting_givenBlankLocation_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> service.extract(""));
    }

    private String sampleLocation() throws Exception {
        return Path.of(getClass().getResource("/taxonomies/sample.json")
                .toURI()).toString();
    }

}
