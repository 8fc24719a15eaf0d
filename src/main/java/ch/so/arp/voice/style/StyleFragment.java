package ch.so.arp.voice.style;

/**
 * Stored fragment of a writing sample. {@code sequence} grows with every append
 * and orders fragments of equal similarity.
 */
public record StyleFragment(long id, long voiceProfileId, long sampleId, String text, float[] vector, long sequence) {
}
