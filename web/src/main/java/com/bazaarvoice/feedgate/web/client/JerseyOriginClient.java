package com.bazaarvoice.feedgate.web.client;

import com.bazaarvoice.feedgate.shape.api.OriginRequestFailedException;
import com.bazaarvoice.feedgate.shape.poll.OriginClient;
import com.bazaarvoice.feedgate.shape.poll.OriginResponse;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.inject.Inject;

import javax.ws.rs.client.Client;
import javax.ws.rs.client.InvocationCallback;
import javax.ws.rs.client.WebTarget;
import javax.ws.rs.core.Response;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

import static java.util.Objects.requireNonNull;

/**
 * {@link OriginClient} implementation using an asynchronous JAX-RS {@link Client}.  Response bodies are buffered in
 * full; a shape response is a bounded batch of rows, never an open stream.
 */
public class JerseyOriginClient implements OriginClient {

    static final String SHAPE_PATH = "v1/shape";

    private final Client _client;

    @Inject
    public JerseyOriginClient(@OriginHttpClient Client client) {
        _client = requireNonNull(client, "client");
    }

    @Override
    public ListenableFuture<OriginResponse> getShape(URI origin, ListMultimap<String, String> queryParams) {
        requireNonNull(origin, "origin");
        requireNonNull(queryParams, "queryParams");

        WebTarget target = _client.target(origin).path(SHAPE_PATH);
        for (Map.Entry<String, String> param : queryParams.entries()) {
            target = target.queryParam(param.getKey(), param.getValue());
        }

        SettableFuture<OriginResponse> result = SettableFuture.create();
        Future<Response> call = target.request().async().get(new InvocationCallback<Response>() {
            @Override
            public void completed(Response response) {
                try {
                    result.set(toOriginResponse(response));
                } catch (RuntimeException e) {
                    result.setException(new OriginRequestFailedException(origin, e));
                } finally {
                    response.close();
                }
            }

            @Override
            public void failed(Throwable throwable) {
                result.setException(new OriginRequestFailedException(origin, throwable));
            }
        });

        // Abort the HTTP call if the caller gives up on it
        result.addListener(() -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        }, MoreExecutors.directExecutor());

        return result;
    }

    private static OriginResponse toOriginResponse(Response response) {
        ListMultimap<String, String> headers = ArrayListMultimap.create();
        for (Map.Entry<String, List<String>> header : response.getStringHeaders().entrySet()) {
            headers.putAll(header.getKey(), header.getValue());
        }
        byte[] body = response.hasEntity() ? response.readEntity(byte[].class) : new byte[0];
        return new OriginResponse(response.getStatus(), headers, body);
    }
}
