package de.conciso.circulargraph.model;

/**
 * {@code scanned} is true when the node's own text was processed for outgoing
 * references during this build. Unscanned nodes only appear as edge targets.
 */
public record GraphNode(
        Identifier identifier,
        String title,
        boolean scanned
) {}
