package udem.cvmatch.batch;

import udem.cvmatch.scoring.DocumentAnalysis;

public record DocumentResult(String documentId, DocumentAnalysis analysis) {

    public double score() {
        return analysis.score().weightedScore();
    }

    public RankedDocument ranked() {
        return new RankedDocument(documentId, score());
    }
}
