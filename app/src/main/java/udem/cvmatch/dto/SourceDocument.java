package udem.cvmatch.dto;

/**
 * A document handed over by text extraction. A null or blank text means extraction failed.
 */
public record SourceDocument(String id, String text) {

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
