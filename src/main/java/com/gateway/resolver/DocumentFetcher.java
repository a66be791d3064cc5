package com.gateway.resolver;

/**
 * Loads the text of a remote document, used for external {@code $ref} targets and for
 * registering specifications from a URL.
 */
public interface DocumentFetcher {

    /**
     * Fetches the document at the given absolute URL.
     *
     * @param url An {@code http} or {@code https} URL without fragment.
     * @return The document text.
     * @throws com.gateway.exception.GatewayException if the document cannot be retrieved.
     */
    String fetch(String url);
}
