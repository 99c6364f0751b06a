package udem.cvmatch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AlgorithmReportDto(
        String algorithm,
        @JsonProperty("time_ms") double timeMs,
        long comparisons
) {
}
