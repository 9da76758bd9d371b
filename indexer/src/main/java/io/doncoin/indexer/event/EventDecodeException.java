package io.doncoin.indexer.event;

public class EventDecodeException extends RuntimeException {

    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
