package io.sigv4.http;

import com.google.common.base.Preconditions;
import com.google.common.collect.ListMultimap;

import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * In-memory request description, for callers that build the HTTP request
 * themselves after signing.
 */
public class DefaultSignableRequest implements SignableRequest {
    private final String method;
    private final URI uri;
    private final ListMultimap<String, String> headers;
    private final byte[] content;

    private DefaultSignableRequest(Builder builder) {
        this.method = builder.method;
        this.uri = builder.uri;
        this.headers = Headers.copyOf(builder.headers);
        this.content = builder.content;
    }

    public static Builder builder(String method, URI uri) {
        return new Builder(method, uri);
    }

    @Override
    public String getMethod() {
        return method;
    }

    @Override
    public URI getUri() {
        return uri;
    }

    @Override
    public synchronized ListMultimap<String, String> getHeaders() {
        return Headers.copyOf(headers);
    }

    @Override
    public synchronized void addHeader(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public synchronized void removeHeaders(String name) {
        headers.removeAll(name);
    }

    /**
     * @return the first value of a header or null
     */
    public synchronized String getFirstHeader(String name) {
        return headers.get(name).stream().findFirst().orElse(null);
    }

    @Override
    public byte[] getContent() {
        return content == null ? null : content.clone();
    }

    public static class Builder {
        private final String method;
        private final URI uri;
        private final ListMultimap<String, String> headers = Headers.newMultimap();
        private byte[] content;

        private Builder(String method, URI uri) {
            Preconditions.checkArgument(method != null && !method.isEmpty(), "method must not be empty");
            Preconditions.checkArgument(uri != null, "uri must not be null");
            this.method = method;
            this.uri = uri;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder content(byte[] content) {
            this.content = content == null ? null : content.clone();
            return this;
        }

        public Builder content(String content) {
            return content(content == null ? null : content.getBytes(StandardCharsets.UTF_8));
        }

        public DefaultSignableRequest build() {
            return new DefaultSignableRequest(this);
        }
    }
}
