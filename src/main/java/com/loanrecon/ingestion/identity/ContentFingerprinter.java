package com.loanrecon.ingestion.identity;

import com.loanrecon.domain.LoanDocument;
import com.loanrecon.ingestion.config.IntakeProperties;
import com.loanrecon.ingestion.content.DocumentContent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content identity: exact SHA-256 hash and a 16x16 perceptual average hash of the first page.
 * Pure and thread-safe.
 */
@Component
@RequiredArgsConstructor
public class ContentFingerprinter {

    static final int HASH_SIZE = 16;
    static final int HASH_BITS = HASH_SIZE * HASH_SIZE;

    private final IntakeProperties intakeProperties;

    /**
     * Text with more than {@code minTextChars} characters after whitespace normalization is hashed as text;
     * otherwise (scanned documents) the first-page image bytes are hashed.
     *
     * @throws FingerprintException when neither usable text nor image is available, or the image is unreadable
     */
    public Fingerprint fingerprint(LoanDocument document, DocumentContent content) {
        String documentId = document.getId();
        if (content == null) {
            throw new FingerprintException("No content for document " + documentId);
        }
        String normalized = normalize(content.text());
        String exact;
        if (normalized.length() > intakeProperties.getMinTextChars()) {
            exact = sha256(normalized.getBytes(StandardCharsets.UTF_8));
        } else if (content.hasImage()) {
            exact = sha256(content.firstPageImage());
        } else {
            throw new FingerprintException("Document " + documentId + " has too little text and no page image");
        }
        String perceptual = content.hasImage() ? averageHash(documentId, content.firstPageImage()) : null;
        return new Fingerprint(exact, perceptual);
    }

    public static boolean isExactDuplicate(Fingerprint a, Fingerprint b) {
        return a != null && b != null && a.exactHash() != null && a.exactHash().equals(b.exactHash());
    }

    /**
     * 1 - hammingBits / totalBits. 0 when either hash is missing or the lengths differ.
     */
    public static double similarity(String hashA, String hashB) {
        if (hashA == null || hashB == null || hashA.isEmpty() || hashA.length() != hashB.length()) {
            return 0.0;
        }
        int distance = 0;
        for (int i = 0; i < hashA.length(); i++) {
            int a = Character.digit(hashA.charAt(i), 16);
            int b = Character.digit(hashB.charAt(i), 16);
            if (a < 0 || b < 0) {
                return 0.0;
            }
            distance += Integer.bitCount(a ^ b);
        }
        return 1.0 - (double) distance / (hashA.length() * 4);
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ");
    }

    static String sha256(byte[] bytes) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Grayscale 16x16 downscale; bit set where the pixel is brighter than the mean. */
    static String averageHash(String documentId, byte[] imageBytes) {
        BufferedImage source;
        try {
            source = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new FingerprintException("Unreadable page image for document " + documentId, e);
        }
        if (source == null) {
            throw new FingerprintException("Unsupported page image format for document " + documentId);
        }
        BufferedImage small = new BufferedImage(HASH_SIZE, HASH_SIZE, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = small.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(source, 0, 0, HASH_SIZE, HASH_SIZE, null);
        } finally {
            g.dispose();
        }
        int[] pixels = new int[HASH_BITS];
        long sum = 0;
        for (int y = 0; y < HASH_SIZE; y++) {
            for (int x = 0; x < HASH_SIZE; x++) {
                int v = small.getRaster().getSample(x, y, 0);
                pixels[y * HASH_SIZE + x] = v;
                sum += v;
            }
        }
        double mean = (double) sum / HASH_BITS;
        StringBuilder hex = new StringBuilder(HASH_BITS / 4);
        for (int i = 0; i < HASH_BITS; i += 4) {
            int nibble = 0;
            for (int j = 0; j < 4; j++) {
                nibble = (nibble << 1) | (pixels[i + j] > mean ? 1 : 0);
            }
            hex.append(Character.forDigit(nibble, 16));
        }
        return hex.toString();
    }
}
