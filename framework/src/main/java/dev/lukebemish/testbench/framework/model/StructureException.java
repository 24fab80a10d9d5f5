package dev.lukebemish.testbench.framework.model;

/**
 * Thrown when the shape of a test tree breaks one of its invariants: a node attached to two parents, a cycle,
 * duplicate sibling ids, or a change to a tree that has already been sealed. Always indicates a bug in whatever
 * built the tree.
 */
public class StructureException extends RuntimeException {
    public StructureException(String message) {
        super(message);
    }
}
