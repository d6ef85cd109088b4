package com.doctext.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long text into overlapping windows of at most {@code chunkSize}
 * characters. A window that does not reach the end of the text is pulled back
 * to the last space inside it, when there is one past the window start.
 * Positions are UTF-16 indexes.
 */
public class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_CHUNK_OVERLAP = 100;

    private final int chunkSize;
    private final int chunkOverlap;

    public TextChunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP);
    }

    /**
     * @throws InvalidChunkConfigurationException if {@code chunkSize <= 0},
     *         {@code chunkOverlap < 0} or {@code chunkOverlap >= chunkSize}
     */
    public TextChunker(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0 || chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new InvalidChunkConfigurationException(chunkSize, chunkOverlap);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public static List<String> split(String text, int chunkSize, int chunkOverlap) {
        return new TextChunker(chunkSize, chunkOverlap).chunk(text);
    }

    public List<String> chunk(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= chunkSize) {
            return List.of(text);
        }
        List<String> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        while (start < length) {
            // may run past the text; only the slice is clamped
            int end = start + chunkSize;
            if (end < length) {
                end = snapToSpace(text, start, end);
            }
            String piece = text.substring(start, Math.min(end, length)).strip();
            if (!piece.isEmpty()) {
                chunks.add(piece);
            }
            start = Math.max(end - chunkOverlap, start + 1);
        }
        return chunks;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    private int snapToSpace(String text, int start, int end) {
        int spaceIndex = text.lastIndexOf(' ', end - 1);
        return spaceIndex > start ? spaceIndex : end;
    }
}
