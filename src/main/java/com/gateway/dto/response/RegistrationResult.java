package com.gateway.dto.response;

import com.gateway.model.Endpoint;
import java.util.List;

/**
 * The outcome of a successful specification registration.
 *
 * @param documentId The identifier of the created {@code ApiDocument}.
 * @param specId     The identifier of the stored specification.
 * @param specFamily The family the document was registered under.
 * @param endpoints  The extracted endpoints, in document order.
 */
public record RegistrationResult(String documentId, String specId, String specFamily, List<Endpoint> endpoints) {
}
