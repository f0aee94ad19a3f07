package com.hdlcov.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Root of an elaborated design: the list of all modules, the top wrapper included. */
public final class Netlist extends Node {
    private final List<Module> modules = new ArrayList<>();

    public Netlist(FileLine fileLine) {
        super(fileLine);
    }

    public List<Module> modules() {
        return Collections.unmodifiableList(modules);
    }

    public Module addModule(Module module) {
        modules.add(adopt(module));
        return module;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public List<Node> children() {
        return List.copyOf(modules);
    }

    @Override
    protected boolean removeChild(Node child) {
        return removeIdentity(modules, child);
    }
}
