package udem.cvmatch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"documents_processed", "documents_skipped", "documents_unprocessed", "total_time_ms", "algorithms", "documents"})
public record BatchReportDto(
        @JsonProperty("documents_processed") int documentsProcessed,
        @JsonProperty("documents_skipped") int documentsSkipped,
        @JsonProperty("documents_unprocessed") int documentsUnprocessed,
        @JsonProperty("total_time_ms") double totalTimeMs,
        Map<String, Totals> algorithms,
        List<DocumentReportDto> documents
) {
    public record Totals(
            long comparisons,
            @JsonProperty("time_ms") double timeMs
    ) {
    }
}
