package co.fanki.taxonomy.hierarchy.domain;

import co.fanki.taxonomy.concept.domain.Concept;
import co.fanki.taxonomy.source.ArcRoles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static co.fanki.taxonomy.TaxonomyFixtures.BALANCE_ROLE;
import static co.fanki.taxonomy.TaxonomyFixtures.abstractConcept;
import static co.fanki.taxonomy.TaxonomyFixtures.concept;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link HierarchyBuilder}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class HierarchyBuilderTest {

    private static final Scope WIDE = Scope.of(ArcRoles.PARENT_CHILD);

    private static final Scope BALANCE =
            Scope.of(ArcRoles.PARENT_CHILD, BALANCE_ROLE);

    private RecordingHierarchyListener listener;
    private HierarchyBuilder builder;

    @BeforeEach
    void setUp() {
        listener = new RecordingHierarchyListener();
        builder = new HierarchyBuilder(listener);
    }

    // -- map -----------------------------------------------------------------

    @Test
    void whenMapping_givenChain_shouldLinkChildrenAndParents() {
        final ParentChildMap map = builder.map(WIDE,
                edges(WIDE, "A", "B", "B", "C"));

        assertEquals(List.of("A", "B", "C"), List.copyOf(map.names()));
        assertEquals(Set.of("B"), map.get("A").children());
        assertEquals("A", map.get("B").parent());
        assertNull(map.get("A").parent());
    }

    @Test
    void whenMapping_givenSamePairTwice_shouldNotDuplicateChild() {
        final ParentChildMap map = builder.map(WIDE,
                edges(WIDE, "A", "B", "A", "B"));

        assertEquals(1, map.get("A").children().size());
    }

    @Test
    void whenMapping_givenAbstractParent_shouldRecordAbstractFlags() {
        final Concept statement = abstractConcept("BalanceSheetAbstract");
        final Concept assets = concept("Assets");

        final ParentChildMap map = builder.map(WIDE,
                List.of(new Edge(statement, assets, WIDE)));

        assertTrue(map.get("BalanceSheetAbstract").isAbstract());
        assertFalse(map.get("Assets").isAbstract());
    }

    @Test
    void whenMapping_givenLinkRoleScope_shouldTagParentsOnly() {
        final ParentChildMap map = builder.map(BALANCE,
                edges(BALANCE, "IncomeStatementAbstract", "Revenue",
                        "Revenue", "ProductRevenue"));

        assertTrue(map.names().contains("[Balance] Revenue"));
        assertTrue(map.names().contains("Revenue"));
        assertEquals(Set.of("Revenue"),
                map.get("[Balance] IncomeStatementAbstract").children());
        assertEquals(Set.of("ProductRevenue"),
                map.get("[Balance] Revenue").children());
    }

    // -- build ---------------------------------------------------------------

    @Test
    void whenBuilding_givenChain_shouldMaterializeNestedTree() {
        final ParentChildMap map = builder.map(WIDE,
                edges(WIDE, "A", "B", "B", "C"));

        final Hierarchy hierarchy = builder.build(WIDE, map,
                RootResolver.resolve(map));

        assertEquals(Set.of("A"), hierarchy.rootNames());
        final HierarchyNode a = hierarchy.get("A");
        assertEquals(List.of("B"), a.childNames());
        assertEquals(List.of("C"), a.child("B").childNames());
        assertTrue(a.child("B").child("C").children().isEmpty());
    }

    @Test
    void whenBuilding_givenTwoNodeCycle_shouldTruncateAtRepeatedNode() {
        final ParentChildMap map = builder.map(WIDE,
                edges(WIDE, "A", "B", "B", "A"));

        final Hierarchy hierarchy = builder.build(WIDE, map,
                RootResolver.resolve(map));

        assertEquals(Set.of("A", "B"), hierarchy.rootNames());
        assertEquals(List.of("B"), hierarchy.get("A").childNames());
        assertTrue(hierarchy.get("A").child("B").children().isEmpty());
        assertAcyclic(hierarchy);
        assertEquals(List.of("A", "B"), listener.cycles);
    }

    @Test
    void whenBuilding_givenRing_shouldUseEveryNodeAsRootWithoutCycles() {
        final ParentChildMap map = builder.map(WIDE,
                edges(WIDE, "A", "B", "B", "C", "C", "A"));

        final Hierarchy hierarchy = builder.build(WIDE, map,
                RootResolver.resolve(map));

        assertEquals(List.of("A", "B", "C"),
                List.copyOf(hierarchy.rootNames()));
        assertEquals(List.of("C"),
                hierarchy.get("A").child("B").childNames());
        assertAcyclic(hierarchy);
    }

    @Test
    void whenBuilding_givenDiamond_shouldKeepSharedChildUnderBothParents() {
        final ParentChildMap map = builder.map(WIDE,
                edges(WIDE, "A", "B", "A", "C", "B", "D", "C", "D"));

        final Hierarchy hierarchy = builder.build(WIDE, map,
                RootResolver.resolve(map));

        final HierarchyNode a = hierarchy.get("A");
        assertEquals(List.of("B", "C"), a.childNames());
        assertEquals(List.of("D"), a.child("B").childNames());
        assertEquals(List.of("D"), a.child("C").childNames());
        assertTrue(listener.cycles.isEmpty());
    }

    @Test
    void whenBuilding_givenRootMissingFromMap_shouldProduceLeaf() {
        final Hierarchy hierarchy = builder.build(WIDE, new ParentChildMap(),
                List.of("Orphan"));

        final HierarchyNode orphan = hierarchy.get("Orphan");
        assertNotNull(orphan);
        assertFalse(orphan.isAbstract());
        assertTrue(orphan.children().isEmpty());
    }

    @Test
    void whenBuilding_givenLinkRoleScope_shouldNameParentWithTagAndChildPlain() {
        final ParentChildMap map = builder.map(BALANCE,
                edges(BALANCE, "Revenue", "ProductRevenue",
                        "IncomeStatementAbstract", "Revenue"));

        final Hierarchy hierarchy = builder.build(BALANCE, map,
                RootResolver.resolve(map));

        assertEquals(List.of("[Balance] Revenue",
                        "[Balance] IncomeStatementAbstract"),
                List.copyOf(hierarchy.rootNames()));
        assertEquals(List.of("Revenue"),
                hierarchy.get("[Balance] IncomeStatementAbstract")
                        .childNames());
    }

    @Test
    void whenBuilding_givenLongChain_shouldKeepEveryLevel() {
        final List<String> pairs = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            pairs.add("N" + i);
            pairs.add("N" + (i + 1));
        }
        final ParentChildMap map = builder.map(WIDE,
                edges(WIDE, pairs.toArray(new String[0])));

        final Hierarchy hierarchy = builder.build(WIDE, map,
                RootResolver.resolve(map));

        HierarchyNode node = hierarchy.get("N0");
        int depth = 0;
        while (!node.children().isEmpty()) {
            node = node.children().get(0);
            depth++;
        }
        assertEquals(500, depth);
    }

    /** Builds edges from parent, child name pairs. */
    private static List<Edge> edges(final Scope scope,
            final String... names) {
        final List<Edge> result = new ArrayList<>();
        for (int i = 0; i < names.length; i += 2) {
            result.add(new Edge(concept(names[i]), concept(names[i + 1]),
                    scope));
        }
        return result;
    }

    private static void assertAcyclic(final Hierarchy hierarchy) {
        for (final HierarchyNode root : hierarchy.roots().values()) {
            assertAcyclic(root, new HashSet<>());
        }
    }

    private static void assertAcyclic(final HierarchyNode node,
            final Set<String> ancestors) {
        assertFalse(ancestors.contains(node.name()),
                node.name() + " appears inside its own subtree");
        ancestors.add(node.name());
        for (final HierarchyNode child : node.children()) {
            assertAcyclic(child, ancestors);
        }
        ancestors.remove(node.name());
    }

}
