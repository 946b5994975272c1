package co.fanki.taxonomy.extraction.application;

import co.fanki.taxonomy.source.TaxonomyLoadException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller exposing extracted taxonomy metadata.
 *
 * <p>Returns concepts, presentation trees, dimensional hierarchies and
 * formula graphs as JSON for a presentation layer to render.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/taxonomy")
@Tag(name = "Taxonomy",
        description = "Extract XBRL taxonomy metadata")
public class TaxonomyController {

    private static final Logger LOG = LoggerFactory.getLogger(
            TaxonomyController.class);

    private final TaxonomyExtractionService extractionService;

    /**
     * Creates a new TaxonomyController.
     *
     * @param theExtractionService the extraction service
     */
    public TaxonomyController(
            final TaxonomyExtractionService theExtractionService) {
        this.extractionService = theExtractionService;
    }

    /**
     * Extracts the metadata of a taxonomy.
     *
     * @param request the request naming the taxonomy location
     * @return the metadata, or an error body
     */
    @PostMapping("/extract")
    @Operation(summary = "Extract taxonomy metadata",
            description = "Loads the taxonomy at the given location and"
                    + " returns its concepts, presentation relationships,"
                    + " dimensions and formulas.")
    public ResponseEntity<?> extract(
            @RequestBody final ExtractRequest request) {

        if (request == null || request.location() == null
                || request.location().isBlank()) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "Taxonomy location is required",
                            "errorCode", "LOCATION_REQUIRED"));
        }

        LOG.info("Taxonomy extraction requested for {}", request.location());

        try {
            return ResponseEntity.ok(
                    extractionService.extract(request.location()));
        } catch (final TaxonomyLoadException e) {
            LOG.warn("Taxonomy extraction failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Request body for a taxonomy extraction.
     *
     * @param location the taxonomy location
     */
    public record ExtractRequest(String location) {}

}
