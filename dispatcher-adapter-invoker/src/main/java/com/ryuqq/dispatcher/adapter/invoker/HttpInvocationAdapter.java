package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.outcome.Fail;
import com.ryuqq.dispatcher.core.outcome.Ok;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * 직접 호출(HTTP) 어댑터.
 *
 * <p>서비스 파라미터 {@code url}로 직렬화된 Operation을 POST합니다. 요청은 비동기로 전송되며
 * submit은 즉시 반환합니다.</p>
 *
 * <ul>
 *   <li>연결 실패, 2xx가 아닌 응답: {@code SUBMISSION_FAILED} 실패 알림</li>
 *   <li>2xx 응답, 동기 전용 서비스: 응답 자체가 결과이므로 Ok 알림</li>
 *   <li>2xx 응답, 그 외: 원격 서비스가 completion 주소로 직접 알림 (어댑터 책임 종료)</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class HttpInvocationAdapter extends AbstractInvocationAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpInvocationAdapter.class);

    public static final String URL_PARAM = "url";

    private final HttpClient client;
    private final OperationSerializer serializer;
    private final HttpInvokerConfig config;

    public HttpInvocationAdapter(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink,
                                 HttpClient client, OperationSerializer serializer, HttpInvokerConfig config) {
        super(descriptor, operation, sink);
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.client = client;
        this.serializer = serializer;
        this.config = config;
    }

    @Override
    protected void doSubmit() throws Exception {
        URI uri = URI.create(descriptor.requireParam(URL_PARAM));
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofMillis(config.requestTimeoutMs()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(serializer.serialize(operation)))
            .build();

        client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .whenComplete((response, error) -> {
                if (error != null) {
                    failSubmission(error);
                } else {
                    handleResponse(uri, response);
                }
            });
    }

    private void handleResponse(URI uri, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.error("Service {} at {} rejected {} with HTTP {}", descriptor.name(), uri,
                operation.getOpId().getValue(), status);
            deliver(Fail.of(Fail.SUBMISSION_FAILED,
                "Service " + descriptor.name() + " responded with HTTP " + status,
                response.body()));
            return;
        }

        if (descriptor.capabilities().synchronousOnly()) {
            log.info("Service {} completed {} synchronously (HTTP {})", descriptor.name(),
                operation.getOpId().getValue(), status);
            deliver(Ok.of(operation.getOpId(), response.body()));
        } else {
            log.debug("Service {} accepted {} (HTTP {})", descriptor.name(), operation.getOpId().getValue(), status);
        }
    }
}
