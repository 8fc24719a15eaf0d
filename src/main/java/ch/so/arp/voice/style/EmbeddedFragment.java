package ch.so.arp.voice.style;

/**
 * Successful embedding of one input text.
 *
 * @param index  position of the text in the batch it came from
 * @param text   the embedded text
 * @param vector its embedding
 */
public record EmbeddedFragment(int index, String text, float[] vector) {
}
