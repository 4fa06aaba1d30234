package de.conciso.circulargraph.report;

import de.conciso.circulargraph.model.DependencyTrace;
import de.conciso.circulargraph.model.ReferenceGraph;

import java.time.Instant;

public record ReportData(
        Instant timestamp,
        String runLabel,
        String indexPath,
        String corpusPath,
        int indexSize,
        ReferenceGraph graph,
        // nur im Trace-Modus gesetzt
        DependencyTrace trace
) {
    public static ReportData of(String runLabel, String indexPath, String corpusPath,
                                int indexSize, ReferenceGraph graph) {
        return new ReportData(Instant.now(), runLabel, indexPath, corpusPath, indexSize, graph, null);
    }

    public ReportData withTrace(DependencyTrace trace) {
        return new ReportData(timestamp, runLabel, indexPath, corpusPath, indexSize, graph, trace);
    }
}
