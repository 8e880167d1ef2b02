package io.vulnscan.providers;

import java.net.URI;
import java.util.Objects;

/**
 * Location and credentials of a REST provider.
 */
public record ProviderEndpoint(URI url, String apiKey, String model) {

    public ProviderEndpoint {
        Objects.requireNonNull(url, "url cannot be null");
    }

    public static ProviderEndpoint of(String url, String apiKey, String model) {
        return new ProviderEndpoint(URI.create(url), apiKey, model);
    }

    /**
     * Same endpoint with {@code path} appended to the URL.
     */
    public URI resolve(String path) {
        String base = url.toString();
        return URI.create(base.endsWith("/") ? base + path.replaceFirst("^/", "") : base + path);
    }

    @Override
    public String toString() {
        // Never print the key
        return "ProviderEndpoint[" + url + ", model=" + model + "]";
    }
}
