package udem.cvmatch.benchmark;

import udem.cvmatch.matching.Algorithm;
import udem.cvmatch.matching.SearchResult;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every {@link Algorithm} over the same text and pattern list, timing each full pass.
 */
public class AlgorithmRunner {

    private final List<Algorithm> algorithms;

    public AlgorithmRunner() {
        this(List.of(Algorithm.values()));
    }

    public AlgorithmRunner(List<Algorithm> algorithms) {
        if (algorithms == null || algorithms.isEmpty())
            throw new IllegalArgumentException("At least one algorithm is required");
        this.algorithms = List.copyOf(algorithms);
    }

    public List<Algorithm> algorithms() {
        return algorithms;
    }

    public RunReport run(String text, List<String> patterns) {
        Map<Algorithm, AlgorithmRun> out = new EnumMap<>(Algorithm.class);
        for (var algorithm : algorithms) out.put(algorithm, runOne(algorithm, text, patterns));
        return new RunReport(out);
    }

    public static AlgorithmRun runOne(Algorithm algorithm, String text, List<String> patterns) {
        List<PatternResult> results = new ArrayList<>(patterns.size());
        long start = System.nanoTime();
        for (String pattern : patterns) {
            SearchResult r = algorithm.search(text, pattern);
            results.add(new PatternResult(pattern, r.occurrences(), r.comparisons()));
        }
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        return new AlgorithmRun(algorithm, elapsedMs, List.copyOf(results));
    }
}
