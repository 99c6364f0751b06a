package udem.cvmatch.benchmark;

import udem.cvmatch.matching.Algorithm;

import java.util.List;
import java.util.Optional;

/**
 * One algorithm's pass over a pattern list. {@code timeMs} covers the whole pass.
 */
public record AlgorithmRun(
        Algorithm algorithm,
        double timeMs,
        List<PatternResult> patterns
) {
    public long totalComparisons() {
        return patterns.stream().mapToLong(PatternResult::comparisons).sum();
    }

    public Optional<PatternResult> resultFor(String pattern) {
        return patterns.stream().filter(p -> p.pattern().equals(pattern)).findFirst();
    }
}
