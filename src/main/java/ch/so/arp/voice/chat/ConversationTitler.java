package ch.so.arp.voice.chat;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.voice.persistence.Conversation;
import ch.so.arp.voice.persistence.ConversationRepository;
import ch.so.arp.voice.persistence.Message;
import ch.so.arp.voice.persistence.MessageRepository;
import ch.so.arp.voice.persistence.MessageRole;
import ch.so.arp.voice.prompt.ChatTurn;
import ch.so.arp.voice.prompt.ComposedRequest;
import ch.so.arp.voice.provider.CancellationToken;
import ch.so.arp.voice.provider.ModelCatalog;

/**
 * Names untitled conversations after their first exchange by asking the title
 * model for a short summary. Failures leave the conversation untitled.
 */
public class ConversationTitler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationTitler.class);

    static final int MAX_TITLE_LENGTH = 60;
    private static final int RESPONSE_PREVIEW = 200;

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final ModelCatalog modelCatalog;
    private final String titleModel;

    public ConversationTitler(ConversationRepository conversationRepository, MessageRepository messageRepository,
            ModelCatalog modelCatalog, String titleModel) {
        this.conversationRepository = Objects.requireNonNull(conversationRepository, "conversationRepository");
        this.messageRepository = Objects.requireNonNull(messageRepository, "messageRepository");
        this.modelCatalog = Objects.requireNonNull(modelCatalog, "modelCatalog");
        this.titleModel = Objects.requireNonNull(titleModel, "titleModel");
    }

    /**
     * Generates and stores a title if the conversation has none yet.
     *
     * @return the new title, empty if none was stored
     */
    public Optional<String> titleIfMissing(long conversationId, String assistantText) {
        try {
            Optional<Conversation> conversation = conversationRepository.findById(conversationId);
            if (conversation.isEmpty() || conversation.get().hasTitle()) {
                return Optional.empty();
            }
            List<Message> messages = messageRepository.findByConversation(conversationId);
            Optional<Message> firstUserMessage = messages.stream()
                    .filter(message -> message.role() == MessageRole.USER)
                    .findFirst();
            if (messages.size() < 2 || firstUserMessage.isEmpty()) {
                return Optional.empty();
            }
            ModelCatalog.ResolvedModel model = modelCatalog.resolve(titleModel)
                    .orElseThrow(() -> new IllegalStateException("Title model '" + titleModel + "' is not configured"));
            StringBuilder response = new StringBuilder();
            model.client().streamChat(titleRequest(firstUserMessage.get().content(), assistantText),
                    model.vendorModel(), response::append, new CancellationToken());
            String title = clean(response.toString());
            if (title.isEmpty()) {
                return Optional.empty();
            }
            conversationRepository.updateTitle(conversationId, title);
            LOGGER.info("Auto-generated title for conversation {}: {}", conversationId, title);
            return Optional.of(title);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to auto-generate title for conversation {}: {}", conversationId, ex.getMessage());
            return Optional.empty();
        }
    }

    static ComposedRequest titleRequest(String userText, String assistantText) {
        String preview = assistantText.length() > RESPONSE_PREVIEW ? assistantText.substring(0, RESPONSE_PREVIEW)
                : assistantText;
        String prompt = "Generate a concise, descriptive title (2-6 words) for this conversation based on the "
                + "user's question and AI response:\n\nUser: " + userText + "\n\nAI: " + preview
                + "...\n\nRespond with only the title, no quotes or additional text.";
        return new ComposedRequest("You write short conversation titles.", List.of(ChatTurn.user(prompt)));
    }

    static String clean(String raw) {
        String title = raw.replace("\"", "").replace("'", "").strip();
        return title.length() > MAX_TITLE_LENGTH ? title.substring(0, MAX_TITLE_LENGTH).strip() : title;
    }
}
