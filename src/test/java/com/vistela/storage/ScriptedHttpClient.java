package com.vistela.storage;

import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.http.ExecutableHttpRequest;
import software.amazon.awssdk.http.HttpExecuteRequest;
import software.amazon.awssdk.http.HttpExecuteResponse;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.SdkHttpRequest;
import software.amazon.awssdk.http.SdkHttpResponse;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Transport that answers S3 requests from a script instead of the network.
 * Once the script runs out every request succeeds.
 */
class ScriptedHttpClient implements SdkHttpClient {

    private final Deque<Step> script = new ArrayDeque<>();
    private final List<SdkHttpRequest> requests = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();

    ScriptedHttpClient thenRespond(int statusCode, String errorCode) {
        script.add(new Step(statusCode, errorCode, false));
        return this;
    }

    ScriptedHttpClient thenFailWithIoError() {
        script.add(new Step(0, null, true));
        return this;
    }

    List<SdkHttpRequest> requests() {
        return requests;
    }

    List<String> bodies() {
        return bodies;
    }

    @Override
    public ExecutableHttpRequest prepareRequest(HttpExecuteRequest request) {
        requests.add(request.httpRequest());
        bodies.add(request.contentStreamProvider()
                .map(provider -> read(provider.newStream()))
                .orElse(""));
        Step step = script.isEmpty() ? new Step(200, null, false) : script.poll();

        return new ExecutableHttpRequest() {
            @Override
            public HttpExecuteResponse call() throws IOException {
                if (step.ioError) {
                    throw new IOException("connection reset");
                }
                return step.statusCode == 200 ? success() : error(step.statusCode, step.errorCode);
            }

            @Override
            public void abort() {
            }
        };
    }

    @Override
    public void close() {
    }

    private static HttpExecuteResponse success() {
        return HttpExecuteResponse.builder()
                .response(SdkHttpResponse.builder()
                        .statusCode(200)
                        .putHeader("x-amz-request-id", "req-ok")
                        .putHeader("Content-Length", "0")
                        .build())
                .responseBody(AbortableInputStream.create(new ByteArrayInputStream(new byte[0])))
                .build();
    }

    private static HttpExecuteResponse error(int statusCode, String errorCode) {
        String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<Error><Code>" + errorCode + "</Code><Message>" + errorCode + "</Message>"
                + "<RequestId>req-" + statusCode + "</RequestId></Error>";
        byte[] body = xml.getBytes(StandardCharsets.UTF_8);
        return HttpExecuteResponse.builder()
                .response(SdkHttpResponse.builder()
                        .statusCode(statusCode)
                        .putHeader("Content-Type", "application/xml")
                        .putHeader("Content-Length", String.valueOf(body.length))
                        .putHeader("x-amz-request-id", "req-" + statusCode)
                        .build())
                .responseBody(AbortableInputStream.create(new ByteArrayInputStream(body)))
                .build();
    }

    private static String read(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static final class Step {
        final int statusCode;
        final String errorCode;
        final boolean ioError;

        Step(int statusCode, String errorCode, boolean ioError) {
            this.statusCode = statusCode;
            this.errorCode = errorCode;
            this.ioError = ioError;
        }
    }
}
