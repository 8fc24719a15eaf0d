package ch.so.arp.voice.provider;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves model ids from configuration to the adapter that serves them.
 * Every configured provider must have a registered {@link LlmClient}.
 */
public class ModelCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelCatalog.class);

    private final Map<String, ResolvedModel> models;

    public ModelCatalog(Map<String, ModelDefinition> definitions, Collection<LlmClient> clients) {
        Map<String, LlmClient> clientsByName = clients.stream()
                .collect(Collectors.toMap(LlmClient::name, Function.identity(), (first, second) -> {
                    throw new IllegalStateException("Duplicate LlmClient for provider " + first.name());
                }));
        Map<String, ResolvedModel> resolved = new LinkedHashMap<>();
        definitions.forEach((id, definition) -> {
            LlmClient client = clientsByName.get(definition.provider());
            if (client == null) {
                throw new IllegalStateException("Model '" + id + "' refers to unknown provider '"
                        + definition.provider() + "', known: " + clientsByName.keySet());
            }
            String vendorModel = definition.vendorModel() != null ? definition.vendorModel() : id;
            resolved.put(id, new ResolvedModel(id, vendorModel, client));
        });
        this.models = Collections.unmodifiableMap(resolved);
        LOGGER.info("Model catalog: {}", resolved.keySet());
    }

    public Optional<ResolvedModel> resolve(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(models.get(modelId));
    }

    public Set<String> modelIds() {
        return models.keySet();
    }

    /**
     * @param id          public model id
     * @param vendorModel identifier passed to the client
     * @param client      adapter serving the model
     */
    public record ResolvedModel(String id, String vendorModel, LlmClient client) {
    }
}
