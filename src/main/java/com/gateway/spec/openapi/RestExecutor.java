package com.gateway.spec.openapi;

import com.gateway.exception.UnsupportedProtocolException;
import com.gateway.model.Endpoint;
import com.gateway.protocol.ProtocolAdapter;
import com.gateway.protocol.RequestResponseAdapter;
import com.gateway.protocol.WireRequest;
import com.gateway.protocol.WireResponse;
import com.gateway.spec.SpecExecutor;

/**
 * Executes REST endpoints through a request/response adapter.
 */
public class RestExecutor implements SpecExecutor {

    @Override
    public WireResponse execute(Endpoint endpoint, WireRequest request, ProtocolAdapter adapter) {
        if (!(adapter instanceof RequestResponseAdapter requestResponse)) {
            throw new UnsupportedProtocolException("Protocol '" + adapter.protocol() + "' cannot execute REST endpoints");
        }
        return requestResponse.execute(request);
    }
}
