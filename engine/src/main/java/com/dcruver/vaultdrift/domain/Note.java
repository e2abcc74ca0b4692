package com.dcruver.vaultdrift.domain;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;

/**
 * A single note as handed over by the ingestion layer.
 *
 * The id is the note's stable path. Virtual notes are derived from a section of
 * a container file (a journal, for instance) and point back to it through
 * {@code sourceRef}.
 */
@Value
@Builder(toBuilder = true)
public class Note {
    String id;
    String title;
    String content;
    LocalDateTime created;
    LocalDateTime modified;
    boolean virtual;
    String sourceRef;

    /**
     * SHA-256 of the content, hex encoded. Key of the semantic cache.
     */
    public String getContentHash() {
        return hash(content == null ? "" : content);
    }

    /**
     * Text handed to the cluster labeler: title plus the start of the body.
     */
    public String labelText(int bodyChars) {
        String body = content == null ? "" : content;
        String head = body.length() > bodyChars ? body.substring(0, bodyChars) : body;
        return (title == null ? "" : title) + " " + head;
    }

    public static String hash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
