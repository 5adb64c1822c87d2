package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.outcome.Fail;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 로컬 프로세스(컨테이너) 어댑터.
 *
 * <p>Operation을 명령행 인자로 직렬화해 격리된 자식 프로세스를 띄웁니다.</p>
 *
 * <pre>
 * docker run --rm -t [-e KEY=VALUE ...] &lt;image&gt; --harmony-action invoke --harmony-input &lt;json&gt;
 * </pre>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>completion 주소의 {@code localhost}를 컨테이너에서 접근 가능한 호스트로 치환해 직렬화</li>
 *   <li>프로세스 시작 후 즉시 반환</li>
 *   <li>stdout/stderr는 별도 작업이 한 줄씩 로그로 흘려보냄. 종료 감지는 이 작업의 완료를 기다리지 않음</li>
 *   <li>{@link Process#onExit()} 시점에 원래 completion 주소가 아직 알림을 기다리면
 *       자식이 알림 전에 죽은 것으로 보고 실패 알림을 대신 전달</li>
 * </ol>
 *
 * <p>정상 종료 시 알림은 자식 프로세스가 직접 보냅니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class LocalProcessInvocationAdapter extends AbstractInvocationAdapter {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessInvocationAdapter.class);

    public static final String IMAGE_PARAM = "image";
    public static final String UNKNOWN_ERROR_MESSAGE = "Service request failed with an unknown error.";

    private final ProcessLauncher launcher;
    private final OperationSerializer serializer;
    private final LocalProcessConfig config;
    private final Executor streamExecutor;

    public LocalProcessInvocationAdapter(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink,
                                         ProcessLauncher launcher, OperationSerializer serializer,
                                         LocalProcessConfig config, Executor streamExecutor) {
        super(descriptor, operation, sink);
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (streamExecutor == null) {
            throw new IllegalArgumentException("streamExecutor cannot be null");
        }
        this.launcher = launcher;
        this.serializer = serializer;
        this.config = config;
        this.streamExecutor = streamExecutor;
    }

    @Override
    protected void doSubmit() throws Exception {
        List<String> command = buildCommand();
        log.info("Launching child process for {}: {}", operation.getOpId().getValue(), String.join(" ", command));

        Process process = launcher.launch(command);
        drain(process.getInputStream(), "child stdout: {}");
        drain(process.getErrorStream(), "child stderr: {}");

        process.onExit().thenAccept(exited -> {
            log.info("Child process for {} exited with code {}", operation.getOpId().getValue(), exited.exitValue());
            checkNotified(exited);
        });
    }

    /**
     * 실행 명령 구성.
     *
     * @return launcher prefix, env 인자, 이미지, invoke 인자 순서의 명령
     * @throws Exception 직렬화 실패 또는 image 파라미터 누락
     */
    List<String> buildCommand() throws Exception {
        String image = descriptor.requireParam(IMAGE_PARAM);
        Operation containerView = operation.withCallback(rewriteCallback(operation.getCallback()));

        List<String> command = new ArrayList<>(config.launcherPrefix());
        for (Map.Entry<String, String> variable : descriptor.env().entrySet()) {
            command.add("-e");
            command.add(variable.getKey() + "=" + variable.getValue());
        }
        command.add(image);
        command.add("--harmony-action");
        command.add("invoke");
        command.add("--harmony-input");
        command.add(serializer.serialize(containerView));
        return command;
    }

    /**
     * completion 주소의 localhost를 callback host로 치환.
     *
     * @param callback 원래 주소
     * @return 치환된 주소, localhost가 아니면 그대로
     * @throws URISyntaxException 주소가 URI가 아닌 경우
     */
    String rewriteCallback(String callback) throws URISyntaxException {
        URI uri = new URI(callback);
        if (!"localhost".equalsIgnoreCase(uri.getHost())) {
            return callback;
        }
        return new URI(uri.getScheme(), uri.getUserInfo(), config.callbackHost(), uri.getPort(),
            uri.getPath(), uri.getQuery(), uri.getFragment()).toString();
    }

    private void drain(InputStream stream, String pattern) {
        CompletableFuture.runAsync(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.info(pattern, line);
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamExecutor).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Could not drain output of child for {}", operation.getOpId().getValue(), error);
            }
        });
    }

    private void checkNotified(Process exited) {
        if (!sink.isAwaiting(operation.getOpId())) {
            return;
        }
        log.error("Child for {} exited with code {} without notifying {}. "
                + "Returning service request failed with an unknown error to the user.",
            operation.getOpId().getValue(), exited.exitValue(), operation.getCallback());
        deliver(Fail.of(Fail.UNKNOWN_ERROR, UNKNOWN_ERROR_MESSAGE, "exit code " + exited.exitValue()));
    }
}
