package com.hdlcov.netlist;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * Base class of every netlist node.
 *
 * <p>Nodes are owned by exactly one parent. Composite nodes adopt their children when they are
 * added, which lets a node unlink itself later on. Subtrees that need to appear in two places
 * must be copied first (see {@link Expr#deepCopy()}).
 */
public abstract class Node {
    private final FileLine fileLine;
    private Node parent;

    protected Node(FileLine fileLine) {
        this.fileLine = Objects.requireNonNull(fileLine, "fileLine");
    }

    public final FileLine fileLine() {
        return fileLine;
    }

    public final Node parent() {
        return parent;
    }

    public abstract void accept(NodeVisitor visitor);

    /** Children in visiting order. The returned list is a snapshot. */
    public List<Node> children() {
        return List.of();
    }

    /** Removes this node from its parent. */
    public final void unlinkFromParent() {
        if (parent == null) {
            throw new IllegalStateException("Node has no parent: " + this);
        }
        if (!parent.removeChild(this)) {
            throw new IllegalStateException("Parent " + parent + " does not hold " + this);
        }
        parent = null;
    }

    protected boolean removeChild(Node child) {
        return false;
    }

    /**
     * Takes ownership of a detached node. A node that already has a parent is rejected, even when
     * that parent is this node.
     */
    protected final <N extends Node> N adopt(N child) {
        Node node = Objects.requireNonNull(child, "child");
        if (node.parent != null) {
            throw new IllegalStateException(
                    "Node " + node + " already belongs to " + node.parent + "; copy it first");
        }
        node.parent = this;
        return child;
    }

    protected static boolean removeIdentity(List<? extends Node> nodes, Node child) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == child) {
                nodes.remove(i);
                return true;
            }
        }
        return false;
    }

    public List<Node> preOrder() {
        List<Node> result = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            result.add(current);
            List<Node> children = current.children();
            ListIterator<Node> iterator = children.listIterator(children.size());
            while (iterator.hasPrevious()) {
                stack.push(iterator.previous());
            }
        }
        return result;
    }

    public String typeName() {
        return getClass().getSimpleName().toUpperCase();
    }

    /** Node specific attributes shown in dumps and log lines. */
    protected String details() {
        return "";
    }

    @Override
    public String toString() {
        String details = details();
        return typeName() + (details.isEmpty() ? "" : " " + details) + " @" + fileLine;
    }
}
