package com.hdlcov.netlist;

/**
 * Internal error tied to a netlist node: the tree holds something an earlier stage should have
 * ruled out. Compilation cannot continue.
 */
public class NetlistException extends RuntimeException {
    private final transient Node node;

    public NetlistException(Node node, String message) {
        super(node.fileLine() + ": %Error: Internal Error: " + message + " (" + node.typeName() + ")");
        this.node = node;
    }

    public Node node() {
        return node;
    }
}
