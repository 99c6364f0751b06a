package udem.cvmatch.scoring;

/**
 * Raised before any matching starts when a job description yields no keyword at all.
 */
public class NoKeywordsConfiguredException extends IllegalArgumentException {
    public NoKeywordsConfiguredException(String message) {
        super(message);
    }
}
