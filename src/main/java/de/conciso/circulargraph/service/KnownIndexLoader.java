package de.conciso.circulargraph.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import de.conciso.circulargraph.exception.MalformedIdentifierException;
import de.conciso.circulargraph.model.DocumentRecord;
import de.conciso.circulargraph.model.Identifier;
import de.conciso.circulargraph.model.IndexEntry;
import de.conciso.circulargraph.model.KnownIndex;
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
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lädt den Known Index entweder aus der Textausgabe des Scrapers
 * ({@code "1. Titel\n   Circular No: ..."}) oder aus einer YAML-Liste.
 */
@Service
public class KnownIndexLoader {

    private static final Logger log = LoggerFactory.getLogger(KnownIndexLoader.class);

    private static final Pattern ENTRY_START = Pattern.compile("^\\s*\\d+\\.\\s+(.*)$");
    private static final Pattern CIRCULAR_NO_LINE = Pattern.compile("^\\s*Circular\\s+No\\.?\\s*:\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> PLACEHOLDERS = Set.of("NOT FOUND", "ERROR", "");

    private final String indexPath;
    private final IdentifierNormalizer normalizer;
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public KnownIndexLoader(@Value("${circulargraph.index.path}") String indexPath,
                            IdentifierNormalizer normalizer) {
        this.indexPath = indexPath;
        this.normalizer = normalizer;
    }

    public KnownIndex load() throws IOException {
        return load(Path.of(indexPath));
    }

    public KnownIndex load(Path path) throws IOException {
        List<IndexEntry> entries = isYaml(path) ? readYaml(path) : readScraperText(path);

        KnownIndex.Builder builder = KnownIndex.builder();
        int skipped = 0;
        for (IndexEntry entry : entries) {
            String raw = entry.circularNo() == null ? "" : entry.circularNo().trim();
            if (PLACEHOLDERS.contains(raw.toUpperCase())) {
                skipped++;
                continue;
            }
            Identifier identifier;
            try {
                identifier = normalizer.normalize(raw);
            } catch (MalformedIdentifierException e) {
                log.warn("Index entry '{}' skipped: {}", entry.title(), e.getMessage());
                skipped++;
                continue;
            }
            String title = entry.title() == null ? "" : entry.title().trim();
            builder.put(new DocumentRecord(identifier, title, entry.url()))
                    .filter(previous -> !Objects.equals(previous.title(), title))
                    .ifPresent(previous -> log.warn("Duplicate index entry {}: '{}' replaced by '{}'",
                            identifier, previous.title(), title));
        }

        KnownIndex index = builder.build();
        log.info("Loaded {} circular(s) into index from {}, {} skipped", index.size(), path, skipped);
        return index;
    }

    // -------------------------------------------------------------------------

    private boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private List<IndexEntry> readYaml(Path path) throws IOException {
        return yaml.readValue(
                path.toFile(),
                yaml.getTypeFactory().constructCollectionType(List.class, IndexEntry.class)
        );
    }

    /**
     * Liest das nummerierte Textformat. Titel dürfen über mehrere Zeilen
     * gehen, bis zur "Circular No:"-Zeile.
     */
    private List<IndexEntry> readScraperText(Path path) throws IOException {
        List<IndexEntry> entries = new ArrayList<>();
        StringBuilder title = null;

        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            Matcher circularNo = CIRCULAR_NO_LINE.matcher(line);
            if (circularNo.matches()) {
                if (title != null) {
                    entries.add(new IndexEntry(circularNo.group(1).trim(), collapse(title), null));
                    title = null;
                }
                continue;
            }
            Matcher start = ENTRY_START.matcher(line);
            if (start.matches()) {
                title = new StringBuilder(start.group(1));
            } else if (title != null && !line.isBlank()) {
                title.append(' ').append(line.trim());
            }
        }
        return entries;
    }

    private String collapse(StringBuilder sb) {
        return sb.toString().replaceAll("\\s+", " ").trim();
    }
}
