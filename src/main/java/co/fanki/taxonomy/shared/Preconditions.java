package co.fanki.taxonomy.shared;

/**
 * Argument checks shared by the taxonomy domain objects.
 *
 * <p>Every check throws {@link IllegalArgumentException}: a violated
 * precondition is a programming error of the caller, never a data
 * quality problem of the taxonomy being read.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Ensures that a reference is present.
     *
     * @param reference the reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference,
            final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string carries text, used for arc-role URIs,
     * link-role URIs and file locations.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a limit such as a traversal depth is not negative.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the number
     * @throws IllegalArgumentException if value is negative
     */
    public static int requireNonNegative(final int value,
            final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
