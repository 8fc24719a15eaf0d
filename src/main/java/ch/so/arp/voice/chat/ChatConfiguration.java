package ch.so.arp.voice.chat;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.voice.persistence.ConversationRepository;
import ch.so.arp.voice.persistence.MessageRepository;
import ch.so.arp.voice.persistence.VoiceProfileRepository;
import ch.so.arp.voice.persistence.WritingSampleRepository;
import ch.so.arp.voice.prompt.PromptComposer;
import ch.so.arp.voice.prompt.WritingStyleAnalyzer;
import ch.so.arp.voice.provider.GeminiClientProperties;
import ch.so.arp.voice.provider.GeminiEmbeddingProvider;
import ch.so.arp.voice.provider.GeminiLlmClient;
import ch.so.arp.voice.provider.LlmClient;
import ch.so.arp.voice.provider.MockLlmClient;
import ch.so.arp.voice.provider.ModelCatalog;
import ch.so.arp.voice.provider.OpenAiClientProperties;
import ch.so.arp.voice.provider.OpenAiEmbeddingProvider;
import ch.so.arp.voice.provider.OpenAiLlmClient;
import ch.so.arp.voice.style.DeterministicEmbeddingProvider;
import ch.so.arp.voice.style.EmbeddingProvider;
import ch.so.arp.voice.style.InMemoryStyleIndex;
import ch.so.arp.voice.style.JdbcStyleIndex;
import ch.so.arp.voice.style.StyleEmbedder;
import ch.so.arp.voice.style.StyleIndex;
import ch.so.arp.voice.style.StyleRetriever;
import ch.so.arp.voice.style.TextChunker;

/**
 * Central configuration wiring the chat components together. It exposes toggles
 * that decide whether mocked or real infrastructure components should be used.
 */
@Configuration
@EnableConfigurationProperties({ ChatProperties.class, OpenAiClientProperties.class, GeminiClientProperties.class })
public class ChatConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService chatExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("voice-chat-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService streamDispatchExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("voice-sse-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService streamWatchdog() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("voice-watchdog-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public SseEmitterFactory sseEmitterFactory(ChatProperties properties) {
        return new DefaultSseEmitterFactory(properties.getSseTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpClient vendorHttpClient(OpenAiClientProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.mock-providers", havingValue = "true", matchIfMissing = true)
    public LlmClient mockOpenAiLlmClient() {
        return new MockLlmClient("openai");
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.mock-providers", havingValue = "true", matchIfMissing = true)
    public LlmClient mockGeminiLlmClient() {
        return new MockLlmClient("gemini");
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.mock-providers", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiClientProperties properties, HttpClient vendorHttpClient,
            ObjectMapper objectMapper) {
        return new OpenAiLlmClient(properties, vendorHttpClient, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.mock-providers", havingValue = "false")
    public LlmClient geminiLlmClient(GeminiClientProperties properties, HttpClient vendorHttpClient,
            ObjectMapper objectMapper) {
        return new GeminiLlmClient(properties, vendorHttpClient, objectMapper);
    }

    @Bean
    public ModelCatalog modelCatalog(ChatProperties properties, List<LlmClient> clients) {
        return new ModelCatalog(properties.getModels(), clients);
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.embedding-provider", havingValue = "deterministic",
            matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(ChatProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getDeterministicDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.embedding-provider", havingValue = "openai")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiClientProperties properties, HttpClient vendorHttpClient,
            ObjectMapper objectMapper) {
        return new OpenAiEmbeddingProvider(properties, vendorHttpClient, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.embedding-provider", havingValue = "gemini")
    public EmbeddingProvider geminiEmbeddingProvider(GeminiClientProperties properties, HttpClient vendorHttpClient,
            ObjectMapper objectMapper) {
        return new GeminiEmbeddingProvider(properties, vendorHttpClient, objectMapper);
    }

    @Bean
    public StyleEmbedder styleEmbedder(EmbeddingProvider embeddingProvider) {
        return new StyleEmbedder(embeddingProvider);
    }

    @Bean
    public TextChunker textChunker(ChatProperties properties) {
        return new TextChunker(properties.getChunkSize(), properties.getChunkOverlap());
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.mock-style-index", havingValue = "true", matchIfMissing = true)
    public StyleIndex inMemoryStyleIndex() {
        return new InMemoryStyleIndex();
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.mock-style-index", havingValue = "false")
    public StyleIndex jdbcStyleIndex(JdbcClient jdbcClient, TransactionTemplate transactionTemplate, Clock clock) {
        return new JdbcStyleIndex(jdbcClient, transactionTemplate, clock);
    }

    @Bean
    public StyleRetriever styleRetriever(StyleEmbedder styleEmbedder, StyleIndex styleIndex) {
        return new StyleRetriever(styleEmbedder, styleIndex);
    }

    @Bean
    public PromptComposer promptComposer() {
        return new PromptComposer();
    }

    @Bean
    public WritingStyleAnalyzer writingStyleAnalyzer() {
        return new WritingStyleAnalyzer();
    }

    @Bean
    public PromptAssembler promptAssembler(MessageRepository messageRepository,
            VoiceProfileRepository profileRepository, WritingSampleRepository sampleRepository,
            StyleRetriever styleRetriever, PromptComposer promptComposer, WritingStyleAnalyzer styleAnalyzer,
            ChatProperties properties) {
        return new PromptAssembler(messageRepository, profileRepository, sampleRepository, styleRetriever,
                promptComposer, styleAnalyzer, properties.getContextLimit(), properties.getStyleFragments());
    }

    @Bean
    @ConditionalOnProperty(name = "voice.chat.auto-title", havingValue = "true", matchIfMissing = true)
    public ConversationTitler conversationTitler(ConversationRepository conversationRepository,
            MessageRepository messageRepository, ModelCatalog modelCatalog, ChatProperties properties) {
        return new ConversationTitler(conversationRepository, messageRepository, modelCatalog,
                properties.getTitleModel());
    }

    @Bean
    public GenerationOrchestrator generationOrchestrator(ConversationRepository conversationRepository,
            MessageRepository messageRepository, VoiceProfileRepository profileRepository,
            PromptAssembler promptAssembler, ModelCatalog modelCatalog, ObjectProvider<ConversationTitler> titler,
            ChatProperties properties, @Qualifier("chatExecutor") ExecutorService chatExecutor,
            @Qualifier("streamDispatchExecutor") ExecutorService streamDispatchExecutor,
            ScheduledExecutorService streamWatchdog) {
        return new GenerationOrchestrator(conversationRepository, messageRepository, profileRepository,
                promptAssembler, modelCatalog, titler.getIfAvailable(), properties, chatExecutor,
                streamDispatchExecutor, streamWatchdog);
    }
}
