package com.nexuscontrol.store;

/**
 * An append or read against the event log failed. The event must be treated as
 * not committed. Callers must not blindly retry, since that can duplicate events.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
