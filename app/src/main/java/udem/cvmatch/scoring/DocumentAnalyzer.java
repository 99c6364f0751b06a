package udem.cvmatch.scoring;

import udem.cvmatch.benchmark.AlgorithmRunner;
import udem.cvmatch.benchmark.PatternResult;
import udem.cvmatch.benchmark.RunReport;
import udem.cvmatch.matching.Algorithm;
import udem.cvmatch.utils.TextNormalizer;

import java.util.*;

/**
 * Scores one document: every keyword is searched by every algorithm for the performance
 * report, and the {@link Algorithm#SCORING} results decide which keywords matched.
 */
public class DocumentAnalyzer {

    private final AlgorithmRunner runner;

    public DocumentAnalyzer() {
        this(new AlgorithmRunner());
    }

    public DocumentAnalyzer(AlgorithmRunner runner) {
        if (!runner.algorithms().contains(Algorithm.SCORING))
            throw new IllegalArgumentException("Runner must include " + Algorithm.SCORING.displayName());
        this.runner = runner;
    }

    public List<Algorithm> algorithms() {
        return runner.algorithms();
    }

    public DocumentAnalysis analyze(String text, KeywordClassification keywords, ScoringConfig config) {
        keywords.requireKeywords();
        config.validate();

        List<String> keywordList = keywords.patterns();
        // keyword -> form actually searched
        Map<String, String> searchable = new LinkedHashMap<>();
        for (String k : keywordList) searchable.put(k, prepare(k, config));

        String prepared = prepare(text == null ? "" : text, config);
        List<String> patterns = searchable.values().stream().distinct().toList();
        RunReport report = runner.run(prepared, patterns);

        Set<String> foundPatterns = new HashSet<>();
        for (PatternResult r : report.run(Algorithm.SCORING).patterns()) {
            if (r.matched()) foundPatterns.add(r.pattern());
        }

        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        searchable.forEach((keyword, pattern) -> (foundPatterns.contains(pattern) ? matched : missing).add(keyword));

        // score on searched forms so keywords that fold together are classified once;
        // a keyword whose searched form is blank keeps its own entry and never matches
        KeywordClassification searched = keywords.mapped(k -> {
            String p = searchable.get(k);
            return p.isBlank() ? k : p;
        });
        DocumentScore score = ScoringEngine.score(foundPatterns, searched, config);
        return new DocumentAnalysis(score, List.copyOf(matched), List.copyOf(missing), report);
    }

    static String prepare(String s, ScoringConfig config) {
        String out = config.normalizeText() ? TextNormalizer.clean(s) : s;
        return config.fold(out);
    }
}
