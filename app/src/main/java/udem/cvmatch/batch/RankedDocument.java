package udem.cvmatch.batch;

import java.util.Comparator;

public record RankedDocument(String documentId, double score) {

    /** Highest score first, ties by ascending id. */
    public static final Comparator<RankedDocument> RANKING =
            Comparator.comparingDouble(RankedDocument::score).reversed()
                    .thenComparing(RankedDocument::documentId);
}
