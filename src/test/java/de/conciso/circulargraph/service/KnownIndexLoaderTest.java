package de.conciso.circulargraph.service;

import de.conciso.circulargraph.model.DocumentRecord;
import de.conciso.circulargraph.model.KnownIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static de.conciso.circulargraph.Fixtures.A;
import static de.conciso.circulargraph.Fixtures.B;
import static de.conciso.circulargraph.Fixtures.C;
import static de.conciso.circulargraph.Fixtures.resource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KnownIndexLoaderTest {

    private final KnownIndexLoader loader = new KnownIndexLoader("unused", new IdentifierNormalizer());

    @Test
    void loadsScraperTextFormat() throws IOException {
        KnownIndex index = loader.load(resource("index.txt"));

        assertThat(index.size()).isEqualTo(3);
        assertThat(index.contains(A)).isTrue();
        assertThat(index.contains(B)).isTrue();
        assertThat(index.resolve(C).orElseThrow().title())
                .isEqualTo("Guidelines for portfolio managers regarding the onboarding of new clients");
    }

    @Test
    void lastEntryWinsForDuplicateIdentifier() throws IOException {
        KnownIndex index = loader.load(resource("index.txt"));

        assertThat(index.resolve(A).orElseThrow().title())
                .isEqualTo("Master Circular for Stock Exchanges (updated)");
    }

    @Test
    void loadsYamlAndSkipsPlaceholdersAndMalformedNumbers() throws IOException {
        KnownIndex index = loader.load(resource("index.yaml"));

        assertThat(index.records()).extracting(DocumentRecord::identifier).containsExactly(A, B);
        assertThat(index.resolve(A).orElseThrow().sourceLocation())
                .isEqualTo("https://www.sebi.gov.in/legal/master-circulars/dec-2021/master-circular-672.html");
    }

    @Test
    void loadsConfiguredPath() throws IOException {
        KnownIndexLoader configured = new KnownIndexLoader(resource("index.yaml").toString(), new IdentifierNormalizer());

        assertThat(configured.load().size()).isEqualTo(2);
    }

    @Test
    void emptyFileGivesEmptyIndex(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("empty.txt"), "");

        assertThat(loader.load(file).size()).isZero();
    }

    @Test
    void missingFileIsFatal(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("does-not-exist.txt")))
                .isInstanceOf(NoSuchFileException.class);
    }
}
