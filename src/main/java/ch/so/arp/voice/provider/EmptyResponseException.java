package ch.so.arp.voice.provider;

/**
 * The vendor stream completed without producing any text.
 */
public class EmptyResponseException extends ProviderException {

    public EmptyResponseException(String provider, String model) {
        super(provider, "model " + model + " returned an empty response");
    }
}
