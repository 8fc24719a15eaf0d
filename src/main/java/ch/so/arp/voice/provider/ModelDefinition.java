package ch.so.arp.voice.provider;

/**
 * Catalog entry binding a public model id to a provider and the identifier the
 * vendor expects.
 *
 * @param provider    name of the {@link LlmClient} serving the model
 * @param vendorModel model identifier sent to the vendor
 */
public record ModelDefinition(String provider, String vendorModel) {
}
