package org.apiwatch.support;

import org.apiwatch.client.ApiCaller;
import org.apiwatch.client.ApiRequest;
import org.apiwatch.client.ApiResponse;
import org.apiwatch.client.UpstreamCallException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted {@link ApiCaller}. Answers 200 with {@code {"ok":true}} until told otherwise.
 */
public class FakeApiCaller implements ApiCaller {

    @FunctionalInterface
    public interface Behaviour {
        ApiResponse answer(ApiRequest request) throws UpstreamCallException;
    }

    private final List<ApiRequest> requests = new CopyOnWriteArrayList<>();
    private volatile Behaviour behaviour = request -> new ApiResponse(200, "{\"ok\":true}", 12);

    @Override
    public ApiResponse call(ApiRequest request) throws UpstreamCallException {
        requests.add(request);
        return behaviour.answer(request);
    }

    public FakeApiCaller respondWith(int status, String body) {
        this.behaviour = request -> new ApiResponse(status, body, 12);
        return this;
    }

    public FakeApiCaller failWith(String message) {
        this.behaviour = request -> {
            throw new UpstreamCallException(message, 5, null);
        };
        return this;
    }

    public FakeApiCaller answer(Behaviour behaviour) {
        this.behaviour = behaviour;
        return this;
    }

    public List<ApiRequest> requests() {
        return requests;
    }

    public ApiRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
