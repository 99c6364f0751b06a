package udem.cvmatch.benchmark;

import udem.cvmatch.matching.Algorithm;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record RunReport(Map<Algorithm, AlgorithmRun> runs) {

    public RunReport {
        runs = Collections.unmodifiableMap(new EnumMap<>(runs));
    }

    public AlgorithmRun run(Algorithm algorithm) {
        var r = runs.get(algorithm);
        if (r == null) throw new IllegalArgumentException("No run recorded for " + algorithm);
        return r;
    }

    /**
     * True when every algorithm reports the same occurrence count for every pattern.
     */
    public boolean consistent() {
        List<PatternResult> reference = null;
        for (var run : runs.values()) {
            if (reference == null) {
                reference = run.patterns();
                continue;
            }
            if (reference.size() != run.patterns().size()) return false;
            for (int i = 0; i < reference.size(); i++) {
                if (reference.get(i).occurrences() != run.patterns().get(i).occurrences()) return false;
            }
        }
        return true;
    }
}
