package com.eainde.compliance.document;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Raw document handed over by the upload collaborator.
 *
 * @param filename original file name, used for logging only
 * @param content  raw bytes
 */
public record DocumentSource(String filename, byte[] content) {

    public DocumentSource {
        Objects.requireNonNull(filename, "filename");
        content = content != null ? content : new byte[0];
    }

    public static DocumentSource ofText(String filename, String text) {
        return new DocumentSource(filename, text.getBytes(StandardCharsets.UTF_8));
    }
}
