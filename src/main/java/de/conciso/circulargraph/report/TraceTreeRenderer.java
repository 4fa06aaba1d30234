package de.conciso.circulargraph.report;

import de.conciso.circulargraph.model.DependencyNode;
import de.conciso.circulargraph.model.DependencyTrace;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rendert einen Trace als ASCII-Baum entlang der Parent-Links.
 * Wiederholt erreichte Knoten werden markiert und nicht weiter aufgeklappt.
 */
@Component
public class TraceTreeRenderer {

    static final String REVISIT_MARK = " (↺ bereits erfasst)";

    public List<String> render(DependencyTrace trace) {
        List<String> lines = new ArrayList<>();
        DependencyNode root = trace.nodes().get(0);
        lines.add(root.identifier().value());
        appendChildren(trace, root, "", lines);
        return lines;
    }

    private void appendChildren(DependencyTrace trace, DependencyNode parent, String prefix, List<String> lines) {
        if (parent.revisit()) return;
        List<DependencyNode> children = trace.childrenOf(parent.identifier(), parent.depth());
        for (int i = 0; i < children.size(); i++) {
            DependencyNode child = children.get(i);
            boolean last = i == children.size() - 1;
            lines.add(prefix + (last ? "└── " : "├── ") + child.identifier().value()
                    + (child.revisit() ? REVISIT_MARK : ""));
            appendChildren(trace, child, prefix + (last ? "    " : "│   "), lines);
        }
    }
}
