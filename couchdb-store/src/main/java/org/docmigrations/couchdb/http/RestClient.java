package org.docmigrations.couchdb.http;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import org.docmigrations.couchdb.CouchDbConnection;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Minimal asynchronous REST client over Reactor Netty. Paths are relative to the connection url.
 */
@Slf4j
public class RestClient {
    private static final String USER_AGENT = "DocumentMigrations-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";

    @Getter
    private final CouchDbConnection connection;
    private final HttpClient client;

    public RestClient(CouchDbConnection connection) {
        this(connection, 0);
    }

    /**
     * @param maxConnections If &gt; 0, an HttpClient will be created with a provider
     *                       that uses this value for maxConnections.  Otherwise, a client
     *                       will be created with default values provided by Reactor.
     */
    public RestClient(CouchDbConnection connection, int maxConnections) {
        this.connection = connection;
        var httpClient = maxConnections <= 0
            ? HttpClient.create()
            : HttpClient.create(ConnectionProvider.create("RestClient", maxConnections));

        if (connection.getProtocol() == CouchDbConnection.Protocol.HTTPS) {
            httpClient = connection.isInsecure()
                ? httpClient.secure(getInsecureSslProvider())
                : httpClient.secure();
        }

        this.client = httpClient
            .baseUrl(connection.getUri().toString())
            .disableRetry(false) // Enable one retry on connection reset with no delay
            .keepAlive(true);
    }

    public Mono<HttpResponse> asyncRequest(HttpMethod method, String path, String body) {
        return client
            .headers(h -> {
                h.add(HttpHeaderNames.USER_AGENT, USER_AGENT);
                h.add(HttpHeaderNames.ACCEPT, JSON_CONTENT_TYPE);
                if (body != null) {
                    h.add(HttpHeaderNames.CONTENT_TYPE, JSON_CONTENT_TYPE);
                }
                connection.basicAuthHeader().ifPresent(value -> h.add(HttpHeaderNames.AUTHORIZATION, value));
            })
            .request(method)
            .uri("/" + path)
            .send(Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8))))
            .responseSingle(
                (response, bytes) -> bytes.asString()
                    .singleOptional()
                    .map(bodyOp -> new HttpResponse(
                        response.status().code(),
                        response.status().reasonPhrase(),
                        extractHeaders(response.responseHeaders()),
                        bodyOp.orElse(null)
                    ))
            )
            .doOnNext(response -> log.atDebug().setMessage("{} /{} -> {}")
                .addArgument(method).addArgument(path).addArgument(response.statusCode).log());
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest(HttpMethod.GET, path, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return asyncRequest(HttpMethod.POST, path, body);
    }

    public Mono<HttpResponse> putAsync(String path, String body) {
        return asyncRequest(HttpMethod.PUT, path, body);
    }

    private static Map<String, String> extractHeaders(io.netty.handler.codec.http.HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(
                Map.Entry::getKey,
                Map.Entry::getValue,
                (v1, v2) -> v1 + "," + v2
            ));
    }

    private static SslProvider getInsecureSslProvider() {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    SSLEngine engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(sslParameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }
}
