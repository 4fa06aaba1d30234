package de.conciso.circulargraph.service;

import de.conciso.circulargraph.exception.UnknownCircularException;
import de.conciso.circulargraph.model.CorpusDocument;
import de.conciso.circulargraph.model.DependencyNode;
import de.conciso.circulargraph.model.DependencyTrace;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.KnownIndex;
import de.conciso.circulargraph.model.ReferenceGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static de.conciso.circulargraph.Fixtures.A;
import static de.conciso.circulargraph.Fixtures.B;
import static de.conciso.circulargraph.Fixtures.C;
import static de.conciso.circulargraph.Fixtures.UNKNOWN;
import static de.conciso.circulargraph.Fixtures.abcGraph;
import static de.conciso.circulargraph.Fixtures.abcIndex;
import static de.conciso.circulargraph.Fixtures.builder;
import static de.conciso.circulargraph.Fixtures.indexOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyTracerTest {

    private static final Identifier X = new Identifier("CIR/2009/1");
    private static final Identifier Y = new Identifier("CIR/2009/2");
    private static final Identifier Z = new Identifier("CIR/2009/3");

    private final DependencyTracer tracer = new DependencyTracer();
    private final ReferenceGraph abc = abcGraph();
    private final KnownIndex abcIndex = abcIndex();

    @Test
    void nodeReachableViaTwoPathsAppearsOnBothLevels() {
        DependencyTrace trace = tracer.trace(A, abc, abcIndex);

        assertThat(trace.identifiersByLevel()).isEqualTo(Map.of(
                0, Set.of(A),
                1, Set.of(B, C),
                2, Set.of(C)));
        assertThat(trace.nodes()).containsExactly(
                DependencyNode.root(A),
                new DependencyNode(B, 1, A, false),
                new DependencyNode(C, 1, A, false),
                new DependencyNode(C, 2, B, true));
        assertThat(trace.distinctDependencies()).containsExactly(B, C);
        assertThat(trace.deepestLevel()).isEqualTo(2);
    }

    @Test
    void startsWithDepthZeroRoot() {
        for (int depth = 0; depth <= 3; depth++) {
            assertThat(tracer.trace(A, abc, abcIndex, depth).nodes().get(0))
                    .isEqualTo(new DependencyNode(A, 0, null, false));
        }
    }

    @Test
    void depthZeroReturnsOnlyTheStart() {
        DependencyTrace trace = tracer.trace(A, abc, abcIndex, 0);

        assertThat(trace.nodes()).containsExactly(DependencyNode.root(A));
        assertThat(trace.distinctDependencies()).isEmpty();
    }

    @Test
    void nodesAtMaxDepthAreNotExpanded() {
        DependencyTrace trace = tracer.trace(A, abc, abcIndex, 1);

        assertThat(trace.nodes()).extracting(DependencyNode::identifier).containsExactly(A, B, C);
        assertThat(trace.deepestLevel()).isEqualTo(1);
    }

    @Test
    void terminatesOnCycles() {
        ReferenceGraph cyclic = builder(1).build(List.of(
                new CorpusDocument("CIR/2009/1", null, "x.txt", "see CIR/2009/2"),
                new CorpusDocument("CIR/2009/2", null, "y.txt", "see CIR/2009/3 and CIR/2009/1"),
                new CorpusDocument("CIR/2009/3", null, "z.txt", "see CIR/2009/1")
        ), indexOf(X, Y, Z));

        DependencyTrace trace = tracer.trace(X, cyclic, indexOf(X, Y, Z), 10);

        assertThat(trace.nodes()).containsExactly(
                DependencyNode.root(X),
                new DependencyNode(Y, 1, X, false),
                new DependencyNode(X, 2, Y, true),
                new DependencyNode(Z, 2, Y, false),
                new DependencyNode(X, 3, Z, true));
        assertThat(trace.distinctDependencies()).containsExactly(Y, Z);
    }

    @Test
    void startWithoutOutgoingEdgesIsValid() {
        DependencyTrace trace = tracer.trace(C, abc, abcIndex);

        assertThat(trace.nodes()).containsExactly(DependencyNode.root(C));
        assertThat(trace.levels()).containsOnlyKeys(0);
    }

    @Test
    void startKnownOnlyToIndexIsValid() {
        KnownIndex index = indexOf(A, B, C, UNKNOWN);

        DependencyTrace trace = tracer.trace(UNKNOWN, abc, index);

        assertThat(trace.nodes()).containsExactly(DependencyNode.root(UNKNOWN));
    }

    @Test
    void unknownStartFailsFast() {
        assertThatThrownBy(() -> tracer.trace(UNKNOWN, abc, abcIndex))
                .isInstanceOf(UnknownCircularException.class)
                .hasMessageContaining(UNKNOWN.value());
    }

    @Test
    void rejectsNegativeDepth() {
        assertThatThrownBy(() -> tracer.trace(A, abc, abcIndex, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void childrenOfFollowsParentLinks() {
        DependencyTrace trace = tracer.trace(A, abc, abcIndex);

        assertThat(trace.childrenOf(A, 0)).extracting(DependencyNode::identifier).containsExactly(B, C);
        assertThat(trace.childrenOf(B, 1)).extracting(DependencyNode::identifier).containsExactly(C);
        assertThat(trace.childrenOf(C, 1)).isEmpty();
    }
}
