package com.fintech.metals.ingestion;

/**
 * How an upstream feed delivers its payload.
 */
public enum FeedMode {

    /** Plain HTTP GET returning one JSON document. */
    JSON,

    /** Server-sent event stream; the first event's data is read and the stream closed. */
    EVENT_STREAM
}
