package relay.adapter.in.telegram;

/**
 * Thrown when the chat transport cannot start with the given configuration.
 */
public class TransportStartupException extends RuntimeException {

    public TransportStartupException(String message) {
        super(message);
    }
}
