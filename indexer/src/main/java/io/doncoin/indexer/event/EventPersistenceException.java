package io.doncoin.indexer.event;

public class EventPersistenceException extends RuntimeException {

    public EventPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
