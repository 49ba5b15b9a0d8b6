package tech.manajer.messaging.protocol;

/**
 * Thrown when an inbound frame cannot be decoded into an operation.
 * The message is safe to send back to the client.
 */
public class FrameDecodingException extends RuntimeException {

    public FrameDecodingException(String message) {
        super(message);
    }

    public FrameDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
