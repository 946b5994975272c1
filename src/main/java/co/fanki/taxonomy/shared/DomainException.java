package co.fanki.taxonomy.shared;

/**
 * Base exception for failures that abort a taxonomy extraction.
 *
 * <p>Data quality problems inside a taxonomy (incomplete relationships,
 * cycles, missing relationship sets) are never raised as exceptions;
 * they are reported and skipped. A domain exception is reserved for
 * conditions the extraction cannot recover from.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new domain exception with the generic error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, "DOMAIN_ERROR");
    }

    /**
     * Creates a new domain exception with a specific error code.
     *
     * @param message the error message
     * @param theErrorCode the error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with error code and cause.
     *
     * @param message the error message
     * @param theErrorCode the error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
