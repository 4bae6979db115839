package com.eainde.verify.extract;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Content-derived claim ids.
 * <p>
 * An id is {@code <DOMAIN>-<12 hex>} where the hex is the head of a SHA-256 over the domain,
 * the section, the normalized statement and the occurrence index of that statement within the
 * section. Whitespace and case changes do not change the id; moving a claim to another
 * section does.
 * </p>
 */
public final class ClaimIds {

    private static final int HASH_CHARS = 12;

    private ClaimIds() {
    }

    public static String derive(String domainId, String section, String statement, int occurrence) {
        String material = String.join("\u001f",
                domainId,
                section == null ? "" : normalize(section),
                normalize(statement),
                Integer.toString(occurrence));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String hex = HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
            return domainId.toUpperCase(Locale.ROOT) + "-" + hex.substring(0, HASH_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String normalize(String text) {
        String collapsed = text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return collapsed.replaceAll("[.!?;:]+$", "");
    }
}
