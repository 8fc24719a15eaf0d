package ch.so.arp.voice.chat;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.voice.ResourceNotFoundException;
import ch.so.arp.voice.persistence.Conversation;
import ch.so.arp.voice.persistence.ConversationRepository;
import ch.so.arp.voice.persistence.Message;
import ch.so.arp.voice.persistence.MessageRepository;

@RestController
@RequestMapping(path = "/api/conversations", produces = MediaType.APPLICATION_JSON_VALUE)
public class ConversationController {

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;

    public ConversationController(ConversationRepository conversationRepository,
            MessageRepository messageRepository) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Conversation create(@RequestHeader(ChatController.USER_HEADER) String userId,
            @RequestBody(required = false) CreateConversationRequest request) {
        String title = request != null && request.title() != null && !request.title().isBlank()
                ? request.title().strip()
                : null;
        return conversationRepository.create(userId, title);
    }

    @GetMapping("/{conversationId}/messages")
    public List<Message> messages(@RequestHeader(ChatController.USER_HEADER) String userId,
            @PathVariable long conversationId) {
        conversationRepository.findById(conversationId)
                .filter(conversation -> conversation.isOwnedBy(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Conversation", conversationId));
        return messageRepository.findByConversation(conversationId);
    }

    public record CreateConversationRequest(String title) {
    }
}
