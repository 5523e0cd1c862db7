package com.fintech.metals.ingestion;

/**
 * Single-shot read of an upstream feed.
 *
 * Implementations return the raw payload of one reading and release the
 * connection on every path, including timeout and error.
 */
@FunctionalInterface
public interface FetchClient {

    /**
     * @return Raw payload text (a JSON document)
     * @throws FetchException on timeout or transport failure
     */
    String fetch(FeedDefinition feed) throws FetchException;
}
