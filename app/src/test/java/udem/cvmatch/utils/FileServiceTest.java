package udem.cvmatch.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import udem.cvmatch.batch.BatchAggregator;
import udem.cvmatch.dto.SourceDocument;
import udem.cvmatch.scoring.KeywordClassification;
import udem.cvmatch.scoring.ScoringConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileServiceTest {

    @TempDir
    Path dir;

    @Test
    void readsJobDescription() throws IOException {
        Path job = dir.resolve("data_scientist.json");
        Files.writeString(job, """
                {"title": "Data Scientist",
                 "required_skills": ["Python", "SQL"],
                 "preferred_skills": "Spark",
                 "location": "remote"}
                """);

        var dto = FileService.readJobDescription(job);
        assertThat(dto.title()).isEqualTo("Data Scientist");
        assertThat(dto.requiredSkills()).containsExactly("Python", "SQL");
        assertThat(dto.preferredSkills()).containsExactly("Spark");
        assertThat(dto.toolsAndFrameworks()).isEmpty();
    }

    @Test
    void readsDocumentsDeduplicatingCopies() throws IOException {
        Files.writeString(dir.resolve("John Doe (1).txt"), "copy");
        Files.writeString(dir.resolve("John Doe.txt"), "original java");
        Files.writeString(dir.resolve("jane.html"), "<html><body><p>Java</p><p>SQL</p></body></html>");
        Files.writeString(dir.resolve("notes.md"), "ignored");
        Files.createDirectories(dir.resolve("sub"));
        Files.writeString(dir.resolve("sub").resolve("Empty.txt"), "");

        List<SourceDocument> docs = FileService.readDocuments(dir);

        assertThat(docs).extracting(SourceDocument::id).containsExactly("empty", "jane", "john_doe");
        assertThat(docs.get(1).text()).isEqualTo("Java SQL");
        assertThat(docs.get(2).text()).isEqualTo("original java");
        assertThat(docs.get(0).hasText()).isFalse();
    }

    @Test
    void readsSingleFile() throws IOException {
        Path cv = dir.resolve("Single CV.txt");
        Files.writeString(cv, "kotlin");
        assertThat(FileService.readDocuments(cv)).containsExactly(new SourceDocument("single_cv", "kotlin"));
    }

    @Test
    void missingSourceIsAnError() {
        assertThatThrownBy(() -> FileService.readDocuments(dir.resolve("nope"))).isInstanceOf(IOException.class);
    }

    @Test
    void scoringConfigFallsBackToDefaults() throws IOException {
        assertThat(FileService.readScoringConfig(dir.resolve("absent.json"), ScoringConfig.defaults()))
                .isEqualTo(ScoringConfig.defaults());

        Path cfg = dir.resolve("scoring.json");
        Files.writeString(cfg, "{\"penalty_percent\": 35.5, \"case_sensitive\": true}");
        var c = FileService.readScoringConfig(cfg, ScoringConfig.defaults());
        assertThat(c.penaltyPercent()).isEqualTo(35.5);
        assertThat(c.caseSensitive()).isTrue();
        assertThat(c.mandatoryWeight()).isEqualTo(0.70);
    }

    @Test
    void writesBatchReportJson() throws IOException {
        var keywords = KeywordClassification.of(List.of("Python", "SQL"), List.of("Go"), List.of());
        var batch = new BatchAggregator(ScoringConfig.defaults()).aggregate(List.of(
                new SourceDocument("b", "python go"),
                new SourceDocument("a", "python sql go"),
                new SourceDocument("x", "")), keywords);

        Path out = dir.resolve("reports").resolve("cv_batch_report.json");
        FileService.writeBatchReport(out, batch);

        JsonNode root = new ObjectMapper().readTree(Files.readString(out));
        assertThat(root.get("documents_processed").asInt()).isEqualTo(2);
        assertThat(root.get("documents_skipped").asInt()).isEqualTo(1);
        assertThat(root.get("documents_unprocessed").asInt()).isZero();
        assertThat(root.has("total_time_ms")).isTrue();
        assertThat(root.get("algorithms").has("KMP")).isTrue();
        assertThat(root.get("algorithms").get("Naive").get("comparisons").asLong()).isPositive();
        assertThat(root.get("documents").get(0).get("document_id").asText()).isEqualTo("a");
        assertThat(root.get("documents").get(1).get("penalty_applied").asBoolean()).isTrue();
        assertThat(root.get("documents").get(0).get("results")).hasSize(3);
        assertThat(root.get("documents").get(0).get("results").get(0).has("time_ms")).isTrue();
    }
}
