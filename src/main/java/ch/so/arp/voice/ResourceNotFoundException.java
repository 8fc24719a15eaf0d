package ch.so.arp.voice;

/**
 * Thrown when a conversation, voice profile or writing sample does not exist or
 * is not owned by the requesting user. Both cases look the same to the caller.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, long id) {
        super(resource + " " + id + " not found");
    }
}
