package co.fanki.taxonomy.source;

import co.fanki.taxonomy.shared.DomainException;

/**
 * Raised when a taxonomy cannot be opened. Aborts the whole extraction.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class TaxonomyLoadException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported to API clients. */
    public static final String ERROR_CODE = "TAXONOMY_LOAD_FAILED";

    /**
     * Creates a new load exception.
     *
     * @param message the error message
     */
    public TaxonomyLoadException(final String message) {
        super(message, ERROR_CODE);
    }

    /**
     * Creates a new load exception with its cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public TaxonomyLoadException(final String message,
            final Throwable cause) {
        super(message, ERROR_CODE, cause);
    }

}
