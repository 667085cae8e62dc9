package com.contentgrid.storage.iam.openid.jwks;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * Where, and through which transport, the identity provider's key set is fetched.
 * <p>
 * Deadlines for the fetch are the responsibility of the transport; no timeout is applied on top of it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JwksEndpoint {

    private static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https");

    @NonNull
    URI uri;

    @NonNull
    ClientHttpRequestFactory transport;

    @NonNull
    ResponseCloser responseCloser;

    public static JwksEndpoint configure(String url) throws JwksConfigurationException {
        return configure(url, new SimpleClientHttpRequestFactory(), ResponseCloser.DEFAULT);
    }

    public static JwksEndpoint configure(String url, @NonNull ClientHttpRequestFactory transport,
            @NonNull ResponseCloser responseCloser) throws JwksConfigurationException {
        if (url == null || url.isBlank()) {
            throw new JwksConfigurationException("JWKSet URL is empty");
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new JwksConfigurationException("Invalid JWKSet URL '%s': %s".formatted(url, e.getMessage()), e);
        }

        if (!uri.isAbsolute() || !SUPPORTED_SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            throw new JwksConfigurationException(
                    "Invalid JWKSet URL '%s': expected an absolute http or https URL".formatted(url));
        }
        if (uri.getHost() == null) {
            throw new JwksConfigurationException("Invalid JWKSet URL '%s': no host".formatted(url));
        }

        return new JwksEndpoint(uri, transport, responseCloser);
    }
}
