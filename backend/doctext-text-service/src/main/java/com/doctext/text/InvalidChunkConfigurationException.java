package com.doctext.text;

/**
 * Chunk window settings that cannot make forward progress.
 */
public class InvalidChunkConfigurationException extends IllegalArgumentException {

    private final int chunkSize;
    private final int chunkOverlap;

    public InvalidChunkConfigurationException(int chunkSize, int chunkOverlap) {
        super("Invalid chunk configuration: size=" + chunkSize + ", overlap=" + chunkOverlap
            + " (require size > 0 and 0 <= overlap < size)");
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }
}
