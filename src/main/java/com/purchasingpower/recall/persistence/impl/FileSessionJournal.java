package com.purchasingpower.recall.persistence.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.exception.PersistenceFailureException;
import com.purchasingpower.recall.model.synthesis.KnowledgeGap;
import com.purchasingpower.recall.model.synthesis.Pattern;
import com.purchasingpower.recall.persistence.JournalEntry;
import com.purchasingpower.recall.persistence.SessionJournal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Journal as a pair of files per session, {@code YYYY-MM-DD_<sessionId>.json}
 * and {@code .md}, the date being the day of the first reflection. The JSON
 * file holds every reflection cycle of the session in order; a cycle written
 * again replaces its earlier entry.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class FileSessionJournal implements SessionJournal {

    private static final TypeReference<List<JournalEntry>> ENTRY_LIST = new TypeReference<>() {
    };
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Path directory;

    @Autowired
    public FileSessionJournal(ObjectMapper objectMapper, AppProperties properties) {
        this(objectMapper, Paths.get(properties.getReflection().getJournalDir()));
    }

    public FileSessionJournal(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
        this.directory = directory;
    }

    @Override
    public void write(JournalEntry entry) {
        String baseName = existingBaseName(entry.getSessionId())
            .orElseGet(() -> DAY.format(entry.getReflectedAt()) + "_" + safe(entry.getSessionId()));

        Path json = directory.resolve(baseName + ".json");
        List<JournalEntry> entries = new ArrayList<>(readEntries(json));
        int existing = indexOfCycle(entries, entry.getCycleId());
        if (existing >= 0) {
            entries.set(existing, entry);
        } else {
            entries.add(entry);
        }
        try {
            AtomicFileWriter.write(json, objectMapper.writeValueAsBytes(entries));
            AtomicFileWriter.write(directory.resolve(baseName + ".md"), toMarkdown(entries));
            log.info("📓 Journal written for session {} cycle {} ({} entries) -> {}",
                entry.getSessionId(), entry.getCycleId(), entries.size(), json);
        } catch (IOException e) {
            log.error("❌ Failed to write journal for session {}: {}", entry.getSessionId(), e.getMessage());
            throw new PersistenceFailureException("Failed to write session journal", json, e);
        }
    }

    @Override
    public Optional<JournalEntry> read(String sessionId) {
        List<JournalEntry> entries = history(sessionId);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    @Override
    public List<JournalEntry> history(String sessionId) {
        return existingBaseName(sessionId)
            .map(baseName -> readEntries(directory.resolve(baseName + ".json")))
            .orElse(List.of());
    }

    private List<JournalEntry> readEntries(Path json) {
        if (!Files.exists(json)) {
            return List.of();
        }
        try {
            JsonNode root = objectMapper.readTree(json.toFile());
            if (root.isArray()) {
                return objectMapper.convertValue(root, ENTRY_LIST);
            }
            // single-entry layout written before cycles were kept
            return List.of(objectMapper.treeToValue(root, JournalEntry.class));
        } catch (IOException e) {
            throw new PersistenceFailureException("Failed to read session journal", json, e);
        }
    }

    private static int indexOfCycle(List<JournalEntry> entries, String cycleId) {
        for (int i = 0; i < entries.size(); i++) {
            if (Objects.equals(entries.get(i).getCycleId(), cycleId)) {
                return i;
            }
        }
        return -1;
    }

    private Optional<String> existingBaseName(String sessionId) {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        String suffix = "_" + safe(sessionId) + ".json";
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + suffix)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                return Optional.of(name.substring(0, name.length() - ".json".length()));
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new PersistenceFailureException("Failed to list session journal", directory, e);
        }
    }

    private static String safe(String sessionId) {
        return sessionId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    static String toMarkdown(List<JournalEntry> entries) {
        StringBuilder md = new StringBuilder();
        md.append("# Session ").append(entries.get(0).getSessionId()).append('\n');
        for (JournalEntry entry : entries) {
            md.append("\n## Cycle ").append(entry.getCycleId()).append("\n\n");
            appendCycle(md, entry);
        }
        return md.toString();
    }

    private static void appendCycle(StringBuilder md, JournalEntry entry) {
        md.append("- Reflected: ").append(entry.getReflectedAt()).append('\n');
        if (entry.getQualityScore() != null) {
            md.append("- Quality: ").append(String.format(Locale.ROOT, "%.2f", entry.getQualityScore())).append('\n');
        }
        md.append("- Interactions: ").append(entry.getInteractions()).append('\n');
        md.append("- Applied: ").append(entry.getLearningsApplied()).append(" learnings, ")
            .append(entry.getCorrectionsApplied()).append(" corrections, ")
            .append(entry.getInsightsAdded()).append(" insights (")
            .append(entry.getInsightsDropped()).append(" dropped)\n");

        if (entry.getSessionSummary() != null && !entry.getSessionSummary().isBlank()) {
            md.append("\n### Summary\n\n").append(entry.getSessionSummary()).append('\n');
        }
        if (!entry.getLearnings().isEmpty()) {
            md.append("\n### Learnings\n\n");
            entry.getLearnings().forEach(l -> md.append("- ").append(l).append('\n'));
        }
        if (!entry.getCorrections().isEmpty()) {
            md.append("\n### Corrections\n\n");
            entry.getCorrections().forEach(c -> md.append("- ").append(c).append('\n'));
        }
        if (!entry.getPatterns().isEmpty()) {
            md.append("\n### Patterns\n\n");
            for (Pattern pattern : entry.getPatterns()) {
                md.append("- ").append(pattern.getPattern());
                if (pattern.getImplication() != null) {
                    md.append(": ").append(pattern.getImplication());
                }
                md.append('\n');
            }
        }
        if (!entry.getKnowledgeGaps().isEmpty()) {
            md.append("\n### Knowledge gaps\n\n");
            for (KnowledgeGap gap : entry.getKnowledgeGaps()) {
                md.append("- ").append(gap.getTopic());
                if (gap.getReason() != null) {
                    md.append(": ").append(gap.getReason());
                }
                md.append('\n');
            }
        }
    }
}
