package co.fanki.taxonomy.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects in the taxonomy model.
 *
 * <p>Value objects are immutable, self-validating and compared by their
 * attributes. Implementations override equals() and hashCode().</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
