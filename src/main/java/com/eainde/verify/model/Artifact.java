package com.eainde.verify.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * One version of a generated artifact (document, source file, contract text...).
 */
public record Artifact(String artifactId, int version, String content) {

    public Artifact {
        Objects.requireNonNull(artifactId, "artifactId");
        Objects.requireNonNull(content, "content");
    }

    public static Artifact initial(String artifactId, String content) {
        return new Artifact(artifactId, 1, content);
    }

    public Artifact nextVersion(String newContent) {
        return new Artifact(artifactId, version + 1, newContent);
    }

    /**
     * SHA-256 of the content, used as the artifact-version identifier in the run ledger.
     */
    public String contentHash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
