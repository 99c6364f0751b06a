package udem.cvmatch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DocumentReportDto(
        @JsonProperty("document_id") String documentId,
        double score,
        @JsonProperty("penalty_applied") boolean penaltyApplied,
        List<AlgorithmReportDto> results
) {
}
