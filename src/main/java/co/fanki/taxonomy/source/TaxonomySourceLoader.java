package co.fanki.taxonomy.source;

/**
 * Opens a taxonomy from a location.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface TaxonomySourceLoader {

    /**
     * Loads the taxonomy found at the given location.
     *
     * @param location where the taxonomy lives, e.g. a file path
     * @return the loaded taxonomy, never null
     * @throws TaxonomyLoadException if the taxonomy cannot be loaded
     */
    TaxonomySource load(String location);

}
