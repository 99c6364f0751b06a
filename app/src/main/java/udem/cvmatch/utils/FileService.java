package udem.cvmatch.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import udem.cvmatch.batch.BatchResult;
import udem.cvmatch.dto.JobDescriptionDto;
import udem.cvmatch.dto.SourceDocument;
import udem.cvmatch.parsers.JobDescriptionParsers;
import udem.cvmatch.report.Reports;
import udem.cvmatch.scoring.ScoringConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class FileService {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final Set<String> TEXT_EXTENSIONS = Set.of(".txt");
    static final Set<String> HTML_EXTENSIONS = Set.of(".html", ".htm");

    public static JobDescriptionDto readJobDescription(Path path) throws IOException {
        return JobDescriptionParsers.parseJobDescription(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static ScoringConfig readScoringConfig(Path path, ScoringConfig base) throws IOException {
        if (path == null || !Files.exists(path)) return base;
        return JobDescriptionParsers.parseScoringConfig(Files.readString(path, StandardCharsets.UTF_8), base);
    }

    /**
     * Loads a single document or every supported file of a directory tree. Files whose names
     * only differ by a "(n)" copy marker share one id; the unmarked file wins, otherwise the
     * first in path order. A file that cannot be read yields a document without text.
     */
    public static List<SourceDocument> readDocuments(Path source) throws IOException {
        if (!Files.exists(source)) throw new IOException("Documents not found: " + source);
        List<Path> files;
        if (Files.isDirectory(source)) {
            try (Stream<Path> paths = Files.walk(source)) {
                files = paths.filter(Files::isRegularFile).filter(FileService::isSupported).sorted().toList();
            }
        } else {
            files = List.of(source);
        }

        Map<String, Path> byId = new TreeMap<>();
        for (Path f : files) {
            String name = f.getFileName().toString();
            String id = TextNormalizer.normalizeName(name);
            Path kept = byId.get(id);
            if (kept == null || (TextNormalizer.hasCopyMarker(kept.getFileName().toString())
                    && !TextNormalizer.hasCopyMarker(name))) {
                byId.put(id, f);
            }
        }
        return byId.entrySet().stream()
                .map(e -> new SourceDocument(e.getKey(), safeExtract(e.getValue())))
                .collect(Collectors.toList());
    }

    static boolean isSupported(Path p) {
        String ext = extension(p);
        return TEXT_EXTENSIONS.contains(ext) || HTML_EXTENSIONS.contains(ext);
    }

    private static String extension(Path p) {
        String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = n.lastIndexOf('.');
        return dot < 0 ? "" : n.substring(dot);
    }

    public static String extractText(Path file) throws IOException {
        String raw = Files.readString(file, StandardCharsets.UTF_8);
        if (HTML_EXTENSIONS.contains(extension(file))) return Jsoup.parse(raw).text();
        return raw;
    }

    private static String safeExtract(Path file) {
        try {
            return extractText(file);
        } catch (IOException e) {
            System.err.println("[Extract] Failed reading " + file + " -> " + e.getMessage());
            return null;
        }
    }

    public static void writeBatchReport(Path out, BatchResult batch) throws IOException {
        createParent(out);
        Files.writeString(
                out,
                MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(Reports.toDto(batch)),
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING
        );
    }

    public static void writeText(Path out, String content) throws IOException {
        createParent(out);
        Files.writeString(out, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    private static void createParent(Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }
}
