package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.source.ArcRoles;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link Scope}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ScopeTest {

    @Test
    void whenTagging_givenLinkRole_shouldUseLastPathSegment() {
        final Scope scope = Scope.of(ArcRoles.DOMAIN_MEMBER,
                "http://example.com/role/Balance");

        assertEquals("[Balance] ", scope.parentTag());
        assertTrue(scope.isLinkRoleSpecific());
    }

    @Test
    void whenTagging_givenArcRoleWideScope_shouldReturnEmptyTag() {
        final Scope scope = Scope.of(ArcRoles.PARENT_CHILD);

        assertEquals("", scope.parentTag());
        assertFalse(scope.isLinkRoleSpecific());
    }

    @Test
    void whenTagging_givenLinkRoleWithoutSlash_shouldUseWholeUri() {
        assertEquals("[urn:role:segments] ",
                Scope.of(ArcRoles.DOMAIN_MEMBER, "urn:role:segments")
                        .parentTag());
    }

    @Test
    void whenComparing_givenSameRoles_shouldBeEqual() {
        assertEquals(Scope.of(ArcRoles.DOMAIN_MEMBER, "http://a/role/X"),
                Scope.of(ArcRoles.DOMAIN_MEMBER, "http://a/role/X"));
        assertNotEquals(Scope.of(ArcRoles.DOMAIN_MEMBER),
                Scope.of(ArcRoles.DOMAIN_MEMBER, "http://a/role/X"));
    }

    @Test
    void whenCreating_givenBlankArcRole_shouldThrowException() {
        assertThrows(IllegalArgumentException.class, () -> Scope.of(" "));
    }

    @Test
    void whenCreating_givenNullLinkRole_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Scope.of(ArcRoles.DOMAIN_MEMBER, null));
    }

}
