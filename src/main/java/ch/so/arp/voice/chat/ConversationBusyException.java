package ch.so.arp.voice.chat;

public class ConversationBusyException extends RuntimeException {

    public ConversationBusyException(long conversationId) {
        super("A response is already being generated for conversation " + conversationId);
    }
}
