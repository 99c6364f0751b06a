package udem.cvmatch;

import udem.cvmatch.batch.BatchAggregator;
import udem.cvmatch.batch.BatchResult;
import udem.cvmatch.dto.JobDescriptionDto;
import udem.cvmatch.dto.SourceDocument;
import udem.cvmatch.report.Reports;
import udem.cvmatch.scoring.DocumentAnalysis;
import udem.cvmatch.scoring.DocumentAnalyzer;
import udem.cvmatch.scoring.KeywordClassification;
import udem.cvmatch.scoring.ScoringConfig;
import udem.cvmatch.utils.FileService;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class Main {
    static final String USAGE = "Usage: Main <job.json> <documents dir|file> [--config scoring.json] "
            + "[--penalty p] [--case-sensitive] [--normalize] [--threads n] [--report out.json]";

    public static void main(String[] args) {
        try {
            System.exit(run(args));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("Failed to run analysis: " + e.getMessage());
            System.exit(1);
        }
    }

    static int run(String[] args) throws Exception {
        Options opts = Options.parse(args);

        ScoringConfig config = FileService.readScoringConfig(opts.configFile, ScoringConfig.defaults());
        if (opts.penalty != null) config = config.withPenaltyPercent(opts.penalty);
        if (opts.caseSensitive) config = config.withCaseSensitive(true);
        if (opts.normalize) config = config.withNormalizeText(true);
        if (opts.threads != null) config = config.withParallelism(opts.threads);
        config.validate();

        JobDescriptionDto job = FileService.readJobDescription(opts.jobFile);
        KeywordClassification keywords = KeywordClassification.from(job).requireKeywords();
        System.out.println("Loaded job " + (job.title() == null ? opts.jobFile.getFileName() : job.title())
                + ": " + keywords.mandatory().size() + " mandatory, " + keywords.preferred().size()
                + " preferred, " + keywords.other().size() + " other keywords");

        List<SourceDocument> docs = FileService.readDocuments(opts.documents);
        if (docs.isEmpty()) {
            System.err.println("No supported documents found in " + opts.documents);
            return 1;
        }

        if (!Files.isDirectory(opts.documents)) {
            SourceDocument doc = docs.get(0);
            if (!doc.hasText()) {
                System.err.println("Could not read text from " + opts.documents);
                return 1;
            }
            DocumentAnalysis analysis = new DocumentAnalyzer().analyze(doc.text(), keywords, config);
            String report = Reports.singleDocument(doc.id(), analysis);
            System.out.print(report);
            if (opts.reportFile != null) {
                FileService.writeText(opts.reportFile, report);
                System.out.println("Wrote report -> " + opts.reportFile);
            }
            return 0;
        }

        BatchResult batch = new BatchAggregator(config).aggregate(docs, keywords);
        if (batch.interrupted()) {
            System.err.println("Batch interrupted, " + batch.unprocessed() + " documents not analysed");
        }
        System.out.println("Ranking:");
        batch.ranking().forEach(r ->
                System.out.println(String.format(Locale.ROOT, "%-40s %8.2f", r.documentId(), r.score())));
        System.out.println("Performance:");
        batch.totals().forEach((a, t) -> System.out.println(String.format(Locale.ROOT,
                "%-12s %12.4f ms %,16d comparisons", a.displayName(), t.timeMs(), t.comparisons())));
        if (opts.reportFile != null) {
            FileService.writeBatchReport(opts.reportFile, batch);
            System.out.println("Wrote batch report -> " + opts.reportFile);
        }
        return 0;
    }

    static final class Options {
        Path jobFile;
        Path documents;
        Path configFile;
        Path reportFile;
        Double penalty;
        Integer threads;
        boolean caseSensitive;
        boolean normalize;

        static Options parse(String[] args) {
            var o = new Options();
            List<String> positional = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--config" -> o.configFile = Path.of(value(args, ++i, a));
                    case "--report" -> o.reportFile = Path.of(value(args, ++i, a));
                    case "--penalty" -> o.penalty = number(value(args, ++i, a), a);
                    case "--threads" -> o.threads = integer(value(args, ++i, a), a);
                    case "--case-sensitive" -> o.caseSensitive = true;
                    case "--normalize" -> o.normalize = true;
                    default -> {
                        if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + a);
                        positional.add(a);
                    }
                }
            }
            if (positional.size() != 2) throw new IllegalArgumentException("Expected a job file and a documents path");
            o.jobFile = Path.of(positional.get(0));
            o.documents = Path.of(positional.get(1));
            return o;
        }

        private static String value(String[] args, int i, String flag) {
            if (i >= args.length) throw new IllegalArgumentException("Missing value for " + flag);
            return args[i];
        }

        private static int integer(String s, String flag) {
            try {
                return Integer.parseInt(s.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an integer for " + flag + ": " + s, e);
            }
        }

        private static double number(String s, String flag) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number for " + flag + ": " + s, e);
            }
        }
    }
}
