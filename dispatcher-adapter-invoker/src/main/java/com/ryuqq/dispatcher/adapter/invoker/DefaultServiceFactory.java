package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.application.dispatch.ServiceFactory;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.descriptor.Mechanism;
import com.ryuqq.dispatcher.core.exception.ConfigurationException;
import com.ryuqq.dispatcher.core.invoker.AdapterProvider;
import com.ryuqq.dispatcher.core.invoker.InvocationAdapter;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import com.ryuqq.dispatcher.core.spi.MessageChannel;
import com.ryuqq.dispatcher.core.spi.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Mechanism별 어댑터 생성기를 시작 시점에 등록해 두는 서비스 팩토리.
 *
 * <p>{@link Mechanism#NO_OP}은 항상 등록됩니다. 등록되지 않은 Mechanism의 서비스가 선택되면
 * {@link ConfigurationException}을 던집니다 (배포 설정 오류).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DefaultServiceFactory factory = DefaultServiceFactory.builder()
 *     .http(HttpClient.newHttpClient(), new HttpInvokerConfig())
 *     .localProcess(ProcessLauncher.system(), LocalProcessConfig.fromEnvironment(System.getenv()))
 *     .queue(messageChannel)
 *     .build();
 * </pre>
 *
 * <p>executor를 지정하지 않으면 팩토리가 직접 만든 스레드 풀을 쓰며, {@link #shutdown()}으로 정리합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class DefaultServiceFactory implements ServiceFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultServiceFactory.class);

    private final Map<Mechanism, AdapterProvider> providers;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final AsynchronizerConfig asynchronizerConfig;

    private DefaultServiceFactory(Map<Mechanism, AdapterProvider> providers, ExecutorService executor,
                                  boolean ownsExecutor, AsynchronizerConfig asynchronizerConfig) {
        this.providers = Collections.unmodifiableMap(new EnumMap<>(providers));
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.asynchronizerConfig = asynchronizerConfig;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public InvocationAdapter build(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        AdapterProvider provider = providers.get(descriptor.mechanism());
        if (provider == null) {
            throw new ConfigurationException("No adapter registered for mechanism \""
                + descriptor.mechanism().tag() + "\" used by service " + descriptor.name());
        }

        if (descriptor.capabilities().requiresAsynchronizer()) {
            log.debug("Wrapping {} adapter for {} in an Asynchronizer", descriptor.mechanism().tag(), descriptor.name());
            return new Asynchronizer(descriptor, operation, sink, provider, executor, asynchronizerConfig);
        }
        return provider.create(descriptor, operation, sink);
    }

    /**
     * @return 등록된 Mechanism
     */
    public Set<Mechanism> registeredMechanisms() {
        return providers.keySet();
    }

    /**
     * 팩토리가 만든 스레드 풀 정리.
     *
     * <p>외부에서 넘겨받은 executor는 건드리지 않습니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }

    /**
     * DefaultServiceFactory 빌더.
     */
    public static final class Builder {

        private final Map<Mechanism, AdapterProvider> custom = new EnumMap<>(Mechanism.class);
        private OperationSerializer serializer = new OperationSerializer();
        private ExecutorService executor;
        private AsynchronizerConfig asynchronizerConfig = new AsynchronizerConfig();
        private HttpClient httpClient;
        private HttpInvokerConfig httpConfig;
        private ProcessLauncher launcher;
        private LocalProcessConfig processConfig;
        private WorkflowEngine workflowEngine;
        private MessageChannel messageChannel;

        private Builder() {
        }

        public Builder serializer(OperationSerializer serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder asynchronizerConfig(AsynchronizerConfig asynchronizerConfig) {
            this.asynchronizerConfig = asynchronizerConfig;
            return this;
        }

        public Builder http(HttpClient httpClient, HttpInvokerConfig config) {
            this.httpClient = httpClient;
            this.httpConfig = config;
            return this;
        }

        /**
         * 설정만으로 HTTP 어댑터 등록. 연결 타임아웃을 적용한 HttpClient를 새로 만듭니다.
         */
        public Builder http(HttpInvokerConfig config) {
            return http(HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
                .build(), config);
        }

        public Builder localProcess(ProcessLauncher launcher, LocalProcessConfig config) {
            this.launcher = launcher;
            this.processConfig = config;
            return this;
        }

        public Builder workflow(WorkflowEngine engine) {
            this.workflowEngine = engine;
            return this;
        }

        public Builder queue(MessageChannel channel) {
            this.messageChannel = channel;
            return this;
        }

        /**
         * 임의 생성기 등록. 같은 Mechanism의 기본 생성기보다 우선합니다.
         */
        public Builder register(Mechanism mechanism, AdapterProvider provider) {
            if (mechanism == null) {
                throw new IllegalArgumentException("mechanism cannot be null");
            }
            if (provider == null) {
                throw new IllegalArgumentException("provider cannot be null");
            }
            custom.put(mechanism, provider);
            return this;
        }

        public DefaultServiceFactory build() {
            if (serializer == null) {
                throw new IllegalArgumentException("serializer cannot be null");
            }
            if (asynchronizerConfig == null) {
                throw new IllegalArgumentException("asynchronizerConfig cannot be null");
            }
            boolean ownsExecutor = executor == null;
            ExecutorService pool = ownsExecutor ? Executors.newCachedThreadPool() : executor;
            OperationSerializer json = serializer;

            Map<Mechanism, AdapterProvider> providers = new EnumMap<>(Mechanism.class);
            providers.put(Mechanism.NO_OP, NoOpInvocationAdapter::new);
            if (httpClient != null) {
                HttpClient client = httpClient;
                HttpInvokerConfig config = httpConfig == null ? new HttpInvokerConfig() : httpConfig;
                providers.put(Mechanism.HTTP, (descriptor, operation, sink) ->
                    new HttpInvocationAdapter(descriptor, operation, sink, client, json, config));
            }
            if (launcher != null) {
                ProcessLauncher processLauncher = launcher;
                LocalProcessConfig config = processConfig == null ? new LocalProcessConfig() : processConfig;
                providers.put(Mechanism.LOCAL_PROCESS, (descriptor, operation, sink) ->
                    new LocalProcessInvocationAdapter(descriptor, operation, sink, processLauncher, json, config, pool));
            }
            if (workflowEngine != null) {
                WorkflowEngine engine = workflowEngine;
                providers.put(Mechanism.WORKFLOW, (descriptor, operation, sink) ->
                    new WorkflowInvocationAdapter(descriptor, operation, sink, engine, json));
            }
            if (messageChannel != null) {
                MessageChannel channel = messageChannel;
                providers.put(Mechanism.QUEUE, (descriptor, operation, sink) ->
                    new QueueInvocationAdapter(descriptor, operation, sink, channel, json));
            }
            providers.putAll(custom);

            log.info("Service factory ready with mechanisms {}", providers.keySet());
            return new DefaultServiceFactory(providers, pool, ownsExecutor, asynchronizerConfig);
        }
    }
}
