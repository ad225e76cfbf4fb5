package com.recipick.ocr;

import java.util.List;

/**
 * Converts an uploaded receipt image into text lines.
 */
public interface TextExtractor {

    /**
     * Whether the extractor is configured well enough to be called.
     */
    boolean isAvailable();

    /**
     * Returns the trimmed, non-blank lines detected in the image, in reading order.
     */
    List<String> extractLines(byte[] image);
}
