package com.loanrecon.ingestion.content;

/**
 * Extracted content of one document: full text (may be empty for scans) and the first-page image bytes
 * (PNG/JPEG, may be null for born-digital documents).
 */
public record DocumentContent(String text, byte[] firstPageImage) {

    public boolean hasImage() {
        return firstPageImage != null && firstPageImage.length > 0;
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
