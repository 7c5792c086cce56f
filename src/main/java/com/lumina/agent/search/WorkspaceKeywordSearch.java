package com.lumina.agent.search;

import com.lumina.agent.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Default SearchCapability: keyword matching over Markdown sections.
 *
 * Each note is split at headings; a section scores the fraction of distinct
 * query terms it contains, with raw term frequency as a small tie-breaker.
 * Good enough until an embedding index is plugged in as another SearchCapability.
 */
@Component
@Slf4j
public class WorkspaceKeywordSearch implements SearchCapability {

    private static final Set<String> NOTE_EXTENSIONS = Set.of("md", "txt");
    private static final int MIN_TERM_LENGTH = 2;

    private final Path root;

    @Autowired
    public WorkspaceKeywordSearch(AgentProperties agentProperties) {
        this(Paths.get(agentProperties.getRag().getIndexRoot()));
    }

    WorkspaceKeywordSearch(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public boolean isReady() {
        return Files.isDirectory(root);
    }

    @Override
    public List<SearchHit> search(String query, int limit) {
        Set<String> terms = terms(query);
        if (terms.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<SearchHit> hits = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(root)) {
            stream.filter(Files::isRegularFile)
                    .filter(this::isNote)
                    .forEach(file -> hits.addAll(scoreFile(file, terms)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }

        return hits.stream()
                .sorted(Comparator.comparingDouble(SearchHit::score).reversed())
                .limit(limit)
                .toList();
    }

    private List<SearchHit> scoreFile(Path file, Set<String> terms) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Skipping unreadable note {}: {}", file, e.getMessage());
            return List.of();
        }

        String relPath = root.relativize(file).toString().replace('\\', '/');
        List<SearchHit> result = new ArrayList<>();
        for (Section section : sections(text)) {
            String lower = section.body().toLowerCase(Locale.ROOT);
            int matched = 0;
            int occurrences = 0;
            for (String term : terms) {
                int count = countOccurrences(lower, term);
                if (count > 0) {
                    matched++;
                    occurrences += count;
                }
            }
            if (matched == 0) continue;
            double score = (double) matched / terms.size() + Math.min(occurrences, 20) / 1000.0;
            result.add(new SearchHit(relPath, section.body().strip(), Math.min(score, 1.0), section.heading()));
        }
        return result;
    }

    static Set<String> terms(String query) {
        if (query == null) return Set.of();
        Set<String> terms = new LinkedHashSet<>();
        Arrays.stream(query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_-]+"))
                .filter(t -> t.length() >= MIN_TERM_LENGTH)
                .forEach(terms::add);
        return terms;
    }

    private static List<Section> sections(String text) {
        List<Section> sections = new ArrayList<>();
        String heading = null;
        StringBuilder body = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            if (line.startsWith("#")) {
                if (!body.toString().isBlank()) {
                    sections.add(new Section(heading, body.toString()));
                }
                heading = line.replaceFirst("^#+\\s*", "").strip();
                body = new StringBuilder(line).append('\n');
            } else {
                body.append(line).append('\n');
            }
        }
        if (!body.toString().isBlank()) {
            sections.add(new Section(heading, body.toString()));
        }
        return sections;
    }

    private static int countOccurrences(String haystack, String needle) {
        int count = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }

    private boolean isNote(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && NOTE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private record Section(String heading, String body) {
    }
}
