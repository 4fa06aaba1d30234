package de.conciso.circulargraph.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import de.conciso.circulargraph.model.CorpusDocument;
import de.conciso.circulargraph.model.CorpusEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Liefert den Korpus als Liste von Dokumenten. Quelle ist entweder ein
 * YAML-Manifest oder ein Verzeichnis mit bereits extrahierten {@code .txt}-Dateien.
 * Fehlende Texte führen nicht zum Abbruch; das Dokument wird ohne Text
 * weitergereicht.
 */
@Service
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    private final String corpusPath;
    private final CircularNumberDetector detector;
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public CorpusLoader(@Value("${circulargraph.corpus.path}") String corpusPath,
                        CircularNumberDetector detector) {
        this.corpusPath = corpusPath;
        this.detector = detector;
    }

    public List<CorpusDocument> load() throws IOException {
        return load(Path.of(corpusPath));
    }

    public List<CorpusDocument> load(Path path) throws IOException {
        List<CorpusDocument> documents = Files.isDirectory(path) ? fromDirectory(path) : fromManifest(path);
        log.info("Loaded {} corpus document(s) from {}", documents.size(), path);
        return documents;
    }

    private List<CorpusDocument> fromManifest(Path manifest) throws IOException {
        List<CorpusEntry> entries = yaml.readValue(
                manifest.toFile(),
                yaml.getTypeFactory().constructCollectionType(List.class, CorpusEntry.class)
        );
        Path baseDir = manifest.toAbsolutePath().getParent();

        List<CorpusDocument> documents = new ArrayList<>();
        for (CorpusEntry entry : entries) {
            Path textFile = entry.textFile() == null ? null : baseDir.resolve(entry.textFile());
            String text = textFile == null ? null : readText(textFile);
            String circularNo = entry.circularNo();
            if (circularNo == null || circularNo.isBlank()) {
                circularNo = detector.detect(text).orElse(null);
            }
            documents.add(new CorpusDocument(circularNo, entry.title(),
                    textFile == null ? entry.title() : textFile.getFileName().toString(), text));
        }
        return documents;
    }

    private List<CorpusDocument> fromDirectory(Path dir) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".txt"))
                    .sorted()
                    .toList();
        }

        List<CorpusDocument> documents = new ArrayList<>();
        for (Path file : files) {
            String text = readText(file);
            String circularNo = detector.detect(text).orElse(null);
            if (circularNo == null) {
                log.debug("No circular number in header of {}", file.getFileName());
            }
            documents.add(new CorpusDocument(circularNo, null, file.getFileName().toString(), text));
        }
        return documents;
    }

    private String readText(Path file) {
        if (!Files.isRegularFile(file)) {
            log.warn("Text file not found: {}", file);
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Text file could not be read: {}", file, e);
            return null;
        }
    }
}
