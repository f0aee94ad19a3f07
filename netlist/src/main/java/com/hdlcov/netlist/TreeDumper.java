package com.hdlcov.netlist;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes an indented, one node per line listing of a tree for debugging. */
public final class TreeDumper {

    private TreeDumper() {}

    public static String dump(Node root) {
        StringBuilder sb = new StringBuilder();
        render(root, 0, sb);
        return sb.toString();
    }

    public static void write(Node root, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(file))) {
            pw.print(dump(root));
        }
    }

    private static void render(Node node, int depth, StringBuilder sb) {
        sb.append("    ".repeat(depth)).append(node).append('\n');
        for (Node child : node.children()) {
            render(child, depth + 1, sb);
        }
    }
}
