package dev.interestmap.ai;

/**
 * Identity and output size of the embedding model an artifact was trained with.
 */
public record EmbedderDescriptor(String name, int dimension) {
}
