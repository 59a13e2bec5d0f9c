package com.loanrecon.ingestion.identity;

/**
 * exactHash: SHA-256 hex. perceptualHash: 256-bit average hash as 64 hex chars, null when no image.
 */
public record Fingerprint(String exactHash, String perceptualHash) {
}
