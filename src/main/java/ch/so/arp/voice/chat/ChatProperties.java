package ch.so.arp.voice.chat;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import ch.so.arp.voice.provider.ModelDefinition;

/**
 * Settings of the chat pipeline. The mock toggles decide whether vendor APIs
 * and the database backed style index are used.
 */
@ConfigurationProperties(prefix = "voice.chat")
public class ChatProperties {

    /**
     * Serve all models from deterministic mock clients.
     */
    private boolean mockProviders = true;

    /**
     * Keep style fragments in memory instead of the {@code style_fragments} table.
     */
    private boolean mockStyleIndex = true;

    /**
     * One of {@code deterministic}, {@code openai} or {@code gemini}.
     */
    private String embeddingProvider = "deterministic";

    private int deterministicDimensions = 768;

    /**
     * Longest silence of a provider stream before the turn fails.
     */
    private Duration idleTimeout = Duration.ofSeconds(60);

    /**
     * Timeout of the SSE response, zero means none.
     */
    private Duration sseTimeout = Duration.ZERO;

    /**
     * Number of earlier messages sent along with a new turn.
     */
    private int contextLimit = 20;

    /**
     * Number of style fragments retrieved per turn.
     */
    private int styleFragments = 3;

    private int chunkSize = 1000;

    private int chunkOverlap = 200;

    private boolean autoTitle = true;

    private String titleModel = "gemini-2.5-flash";

    private String defaultModel = "gemini-2.5-flash";

    private Map<String, ModelDefinition> models = new LinkedHashMap<>();

    public boolean isMockProviders() {
        return mockProviders;
    }

    public void setMockProviders(boolean mockProviders) {
        this.mockProviders = mockProviders;
    }

    public boolean isMockStyleIndex() {
        return mockStyleIndex;
    }

    public void setMockStyleIndex(boolean mockStyleIndex) {
        this.mockStyleIndex = mockStyleIndex;
    }

    public String getEmbeddingProvider() {
        return embeddingProvider;
    }

    public void setEmbeddingProvider(String embeddingProvider) {
        this.embeddingProvider = embeddingProvider;
    }

    public int getDeterministicDimensions() {
        return deterministicDimensions;
    }

    public void setDeterministicDimensions(int deterministicDimensions) {
        this.deterministicDimensions = deterministicDimensions;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public Duration getSseTimeout() {
        return sseTimeout;
    }

    public void setSseTimeout(Duration sseTimeout) {
        this.sseTimeout = sseTimeout;
    }

    public int getContextLimit() {
        return contextLimit;
    }

    public void setContextLimit(int contextLimit) {
        this.contextLimit = contextLimit;
    }

    public int getStyleFragments() {
        return styleFragments;
    }

    public void setStyleFragments(int styleFragments) {
        this.styleFragments = styleFragments;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public boolean isAutoTitle() {
        return autoTitle;
    }

    public void setAutoTitle(boolean autoTitle) {
        this.autoTitle = autoTitle;
    }

    public String getTitleModel() {
        return titleModel;
    }

    public void setTitleModel(String titleModel) {
        this.titleModel = titleModel;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public Map<String, ModelDefinition> getModels() {
        return models;
    }

    public void setModels(Map<String, ModelDefinition> models) {
        this.models = models;
    }
}
