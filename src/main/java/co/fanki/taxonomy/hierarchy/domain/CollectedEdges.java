package co.fanki.taxonomy.hierarchy.domain;

import java.util.List;

/**
 * The outcome of collecting the edges of one scope.
 *
 * @param edges the valid edges in document order
 * @param skipped the relationships left out
 * @param total the number of relationships examined
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CollectedEdges(
        List<Edge> edges,
        List<SkippedRelationship> skipped,
        int total) {

    public CollectedEdges {
        edges = List.copyOf(edges);
        skipped = List.copyOf(skipped);
    }
}
