package ch.so.arp.voice.style;

/**
 * A fragment together with its cosine similarity to a query.
 */
public record ScoredFragment(StyleFragment fragment, double score) {

    public String text() {
        return fragment.text();
    }
}
