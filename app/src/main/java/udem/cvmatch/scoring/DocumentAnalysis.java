package udem.cvmatch.scoring;

import udem.cvmatch.benchmark.RunReport;

import java.util.List;

public record DocumentAnalysis(
        DocumentScore score,
        List<String> matched,
        List<String> missing,
        RunReport performance
) {
}
