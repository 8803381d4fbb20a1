package com.automagik.telemetry.transport.http;

/** A single event could not be rendered for the wire; the event is dropped and the batch goes on. */
public class EventEncodingException extends Exception {

    public EventEncodingException(String message) {
        super(message);
    }
}
