package tech.manajer.messaging.protocol;

/**
 * Thrown when an envelope names an operation that does not exist.
 */
public class UnknownOperationException extends FrameDecodingException {

    public UnknownOperationException(String type) {
        super("Unknown message type: " + type);
    }
}
