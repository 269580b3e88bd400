package io.databrain.graph;

/**
 * A node adjacent to some focus node, together with the strongest link joining them.
 */
public record Neighbor(Node node, Link link) {

    public double strength() {
        return link.strength();
    }

    /** True when the link points from the focus node to this neighbor. */
    public boolean outgoing() {
        return link.targetId().equals(node.id());
    }
}
