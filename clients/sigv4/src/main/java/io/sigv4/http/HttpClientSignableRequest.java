package io.sigv4.http;

import com.google.common.collect.ListMultimap;
import io.sigv4.auth.MalformedRequestException;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.HttpHost;
import org.apache.http.HttpRequest;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.BufferedHttpEntity;
import org.apache.http.util.EntityUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Adapts an Apache HttpClient request. Relative request URIs, as seen by
 * protocol interceptors, are resolved against the target host.
 */
public class HttpClientSignableRequest implements SignableRequest {
    private final HttpRequest request;
    private final HttpHost target;

    public HttpClientSignableRequest(HttpRequest request, HttpHost target) {
        this.request = request;
        this.target = target;
    }

    @Override
    public String getMethod() {
        return request.getRequestLine().getMethod();
    }

    @Override
    public URI getUri() {
        String requestUri = request.getRequestLine().getUri();
        try {
            URI uri = new URI(requestUri);
            if (uri.isAbsolute() || target == null) {
                return uri;
            }
            return new URIBuilder(uri)
                    .setScheme(target.getSchemeName())
                    .setHost(target.getHostName())
                    .setPort(target.getPort())
                    .build();
        } catch (URISyntaxException e) {
            throw new MalformedRequestException(String.format("Unparseable request URI %s", requestUri), e);
        }
    }

    @Override
    public ListMultimap<String, String> getHeaders() {
        ListMultimap<String, String> headers = Headers.newMultimap();
        for (Header header : request.getAllHeaders()) {
            headers.put(header.getName(), header.getValue());
        }
        return headers;
    }

    @Override
    public void addHeader(String name, String value) {
        request.addHeader(name, value);
    }

    @Override
    public void removeHeaders(String name) {
        request.removeHeaders(name);
    }

    @Override
    public byte[] getContent() throws IOException {
        if (!(request instanceof HttpEntityEnclosingRequest)) {
            return null;
        }
        HttpEntityEnclosingRequest enclosingRequest = (HttpEntityEnclosingRequest) request;
        HttpEntity entity = enclosingRequest.getEntity();
        if (entity == null) {
            return null;
        }
        if (!entity.isRepeatable()) {
            // the body is read here and again when sent
            entity = new BufferedHttpEntity(entity);
            enclosingRequest.setEntity(entity);
        }
        return EntityUtils.toByteArray(entity);
    }
}
