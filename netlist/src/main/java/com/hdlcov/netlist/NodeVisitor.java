package com.hdlcov.netlist;

import java.util.List;

/**
 * Visitor over netlist nodes with one method per node kind.
 *
 * <p>Every kind falls back to {@link #visitNode(Node)}, which visits the children. Iteration
 * always works on a snapshot of the child list, so a visit may append to or unlink from the list
 * being walked.
 */
public abstract class NodeVisitor {

    public void visit(Netlist node) {
        visitNode(node);
    }

    public void visit(Module node) {
        visitNode(node);
    }

    public void visit(Procedure node) {
        visitNode(node);
    }

    public void visit(Task node) {
        visitNode(node);
    }

    public void visit(Loop node) {
        visitNode(node);
    }

    public void visit(If node) {
        visitNode(node);
    }

    public void visit(Case node) {
        visitNode(node);
    }

    public void visit(CaseItem node) {
        visitNode(node);
    }

    public void visit(Cover node) {
        visitNode(node);
    }

    public void visit(Stop node) {
        visitNode(node);
    }

    public void visit(Pragma node) {
        visitNode(node);
    }

    public void visit(Begin node) {
        visitNode(node);
    }

    public void visit(Var node) {
        visitNode(node);
    }

    public void visit(Assign node) {
        visitNode(node);
    }

    public void visit(Display node) {
        visitNode(node);
    }

    public void visit(CoverDecl node) {
        visitNode(node);
    }

    public void visit(CoverInc node) {
        visitNode(node);
    }

    public void visit(CoverToggle node) {
        visitNode(node);
    }

    public void visit(Expr node) {
        visitNode(node);
    }

    protected void visitNode(Node node) {
        iterateChildren(node);
    }

    protected final void iterateChildren(Node node) {
        iterateAll(node.children());
    }

    protected final void iterateAll(List<? extends Node> nodes) {
        for (Node child : List.copyOf(nodes)) {
            child.accept(this);
        }
    }
}
