package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.shared.Preconditions;
import co.fanki.taxonomy.shared.ValueObject;

import java.util.Objects;

/**
 * The (arc-role, link role) pair a hierarchy is built for.
 *
 * <p>A scope without link role covers every arc of the arc-role across
 * the whole taxonomy.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Scope implements ValueObject {

    private static final long serialVersionUID = 1L;

    private final String arcRole;
    private final String linkRole;

    private Scope(final String theArcRole, final String theLinkRole) {
        this.arcRole = Preconditions.requireNonBlank(theArcRole,
                "Arc-role is required");
        this.linkRole = theLinkRole;
    }

    /**
     * Creates a scope over every link role of an arc-role.
     *
     * @param arcRole the arc-role URI
     * @return the scope
     */
    public static Scope of(final String arcRole) {
        return new Scope(arcRole, null);
    }

    /**
     * Creates a scope narrowed to one link role.
     *
     * @param arcRole the arc-role URI
     * @param linkRole the extended link role URI
     * @return the scope
     */
    public static Scope of(final String arcRole, final String linkRole) {
        Preconditions.requireNonBlank(linkRole, "Link role is required");
        return new Scope(arcRole, linkRole);
    }

    public String arcRole() {
        return arcRole;
    }

    /**
     * Returns the link role URI.
     *
     * @return the link role, or null for an arc-role wide scope
     */
    public String linkRole() {
        return linkRole;
    }

    public boolean isLinkRoleSpecific() {
        return linkRole != null;
    }

    /**
     * Returns the tag prepended to parent names in this scope.
     *
     * <p>The tag is the last path segment of the link role URI between
     * brackets followed by a space: {@code .../role/Balance} gives
     * {@code "[Balance] "}. Arc-role wide scopes have no tag.</p>
     *
     * @return the tag, empty when the scope has no link role
     */
    public String parentTag() {
        if (linkRole == null) {
            return "";
        }
        return "[" + linkRole.substring(linkRole.lastIndexOf('/') + 1) + "] ";
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Scope)) {
            return false;
        }
        final Scope other = (Scope) o;
        return arcRole.equals(other.arcRole)
                && Objects.equals(linkRole, other.linkRole);
    }

    @Override
    public int hashCode() {
        return Objects.hash(arcRole, linkRole);
    }

    @Override
    public String toString() {
        return linkRole == null ? arcRole : arcRole + " @ " + linkRole;
    }

}
