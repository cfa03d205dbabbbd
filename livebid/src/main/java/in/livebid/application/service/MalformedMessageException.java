package in.livebid.application.service;

/**
 * A client message that cannot be understood. Answered with an ERROR notice; the connection
 * stays open.
 */
public class MalformedMessageException extends Exception {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
