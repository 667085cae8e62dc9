package com.contentgrid.storage.iam.openid.jwks;

import org.springframework.http.client.ClientHttpResponse;

/**
 * Releases the resources held by a key set response once it has been consumed, or abandoned after a failure.
 */
@FunctionalInterface
public interface ResponseCloser {

    ResponseCloser DEFAULT = ClientHttpResponse::close;

    void close(ClientHttpResponse response);
}
