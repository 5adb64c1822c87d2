package com.ryuqq.dispatcher.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.ryuqq.dispatcher.core.descriptor.Capabilities;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptorStore;
import com.ryuqq.dispatcher.core.descriptor.Mechanism;
import com.ryuqq.dispatcher.core.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 서비스 설정을 읽어 {@link CapabilityDescriptorStore}를 만드는 로더.
 *
 * <p>프로세스 시작 시 명시적으로 한 번 호출합니다. 같은 입력을 두 번 읽으면 같은 순서의
 * 같은 설명자 목록을 돌려줍니다.</p>
 *
 * <p><strong>설정 형식:</strong></p>
 * <pre>
 * default:
 *   - name: harmony/netcdf-to-zarr
 *     type:
 *       name: docker
 *       single_granule_requests: true
 *       params:
 *         image: harmonyservices/netcdf-to-zarr:latest
 *     collections:
 *       - C1234-PODAAC
 *     maximum_async_granules: 500
 *     env:
 *       USE_LOCALSTACK: 'true'
 *     capabilities:
 *       output_formats:
 *         - application/x-zarr
 *       subsetting:
 *         variable: false
 *         bbox: false
 * </pre>
 *
 * <p>{@code enabled: false} (불리언 또는 문자열)인 항목은 저장소에서 제외됩니다.
 * 알 수 없는 {@code type.name}, 필수 필드 누락, 형식 오류는 {@link ConfigurationException}입니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class DescriptorLoader {

    private static final Logger log = LoggerFactory.getLogger(DescriptorLoader.class);

    private final DescriptorLoaderConfig config;
    private final ObjectMapper yamlMapper = new YAMLMapper();
    private final ObjectMapper jsonMapper = new JsonMapper();

    public DescriptorLoader() {
        this(new DescriptorLoaderConfig());
    }

    public DescriptorLoader(DescriptorLoaderConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 파일에서 로드. 형식은 확장자로 결정합니다.
     *
     * @param path 설정 파일 경로
     * @return 설명자 저장소
     * @throws ConfigurationException 읽기 실패 또는 설정 오류
     */
    public CapabilityDescriptorStore load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        DescriptorFormat format = DescriptorFormat.fromFileName(path.getFileName().toString());
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, format);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read service configuration " + path, e);
        }
    }

    /**
     * 클래스패스 리소스에서 로드.
     *
     * @param resource 리소스 이름 (예: {@code config/services.yml})
     * @return 설명자 저장소
     * @throws ConfigurationException 리소스가 없거나 설정 오류
     */
    public CapabilityDescriptorStore loadResource(String resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        DescriptorFormat format = DescriptorFormat.fromFileName(resource);
        InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationException("Service configuration resource not found: " + resource);
        }
        try (in) {
            return load(in, format);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read service configuration " + resource, e);
        }
    }

    /**
     * 스트림에서 로드. 스트림은 닫지 않습니다.
     *
     * @param in 설정 내용
     * @param format 형식
     * @return 설명자 저장소
     * @throws ConfigurationException 설정 오류
     */
    public CapabilityDescriptorStore load(InputStream in, DescriptorFormat format) {
        if (in == null) {
            throw new IllegalArgumentException("in cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }

        JsonNode root;
        try {
            root = (format == DescriptorFormat.YAML ? yamlMapper : jsonMapper).readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed service configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read service configuration", e);
        }
        return fromTree(root);
    }

    CapabilityDescriptorStore fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Service configuration must be a mapping of profiles");
        }
        JsonNode entries = root.get(config.profile());
        if (entries == null || !entries.isArray()) {
            throw new ConfigurationException("Service configuration has no service list for profile \""
                + config.profile() + "\"");
        }

        List<CapabilityDescriptor> descriptors = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : entries) {
            index++;
            if (!entry.isObject()) {
                throw new ConfigurationException("Service entry " + index + " must be a mapping");
            }
            String name = requiredText(entry, "name", "Service entry " + index);
            if (isDisabled(entry.get("enabled"))) {
                log.debug("Skipping disabled service {}", name);
                continue;
            }
            CapabilityDescriptor descriptor = toDescriptor(name, entry);
            warnOnGranuleLimit(descriptor);
            descriptors.add(descriptor);
        }

        CapabilityDescriptorStore store;
        try {
            store = CapabilityDescriptorStore.of(descriptors);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid service configuration: " + e.getMessage(), e);
        }
        log.info("Loaded {} enabled services for profile {}", store.size(), config.profile());
        return store;
    }

    private CapabilityDescriptor toDescriptor(String name, JsonNode entry) {
        JsonNode type = entry.get("type");
        if (type == null || !type.isObject()) {
            throw new ConfigurationException("Service " + name + " is missing \"type\"");
        }
        Mechanism mechanism = Mechanism.fromTag(requiredText(type, "name", "Service " + name + " type"));

        JsonNode capabilitiesNode = entry.path("capabilities");
        JsonNode subsetting = capabilitiesNode.path("subsetting");
        Capabilities capabilities = new Capabilities(
            textList(capabilitiesNode.get("output_formats"), name, "capabilities.output_formats"),
            subsetting.path("variable").asBoolean(false),
            subsetting.path("bbox").asBoolean(false),
            type.path("single_granule_requests").asBoolean(false),
            type.path("synchronous_only").asBoolean(false));

        JsonNode granules = entry.get("maximum_async_granules");
        Integer maximumAsyncGranules = null;
        if (granules != null && !granules.isNull()) {
            if (!granules.canConvertToInt()) {
                throw new ConfigurationException("Service " + name + " has a non-integer maximum_async_granules");
            }
            maximumAsyncGranules = granules.asInt();
        }

        try {
            return new CapabilityDescriptor(
                name,
                mechanism,
                textList(entry.get("collections"), name, "collections"),
                capabilities,
                textMap(type.get("params"), name, "type.params"),
                textMap(entry.get("env"), name, "env"),
                maximumAsyncGranules,
                null);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Service " + name + " is invalid: " + e.getMessage(), e);
        }
    }

    private void warnOnGranuleLimit(CapabilityDescriptor descriptor) {
        Integer requested = descriptor.maximumAsyncGranules();
        if (requested != null && requested > config.maxGranuleLimit()) {
            log.warn("Service {} attempting to allow more than the max allowed granules in a request. "
                    + "Configured to use {}, but will be limited to {}",
                descriptor.name(), requested, config.maxGranuleLimit());
        }
    }

    private static boolean isDisabled(JsonNode enabled) {
        if (enabled == null || enabled.isNull()) {
            return false;
        }
        if (enabled.isBoolean()) {
            return !enabled.booleanValue();
        }
        return enabled.isTextual() && "false".equals(enabled.textValue());
    }

    private static String requiredText(JsonNode node, String field, String owner) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.asText().isBlank()) {
            throw new ConfigurationException(owner + " is missing \"" + field + "\"");
        }
        return value.asText();
    }

    private static List<String> textList(JsonNode node, String name, String field) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("Service " + name + " field " + field + " must be a list");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode value : node) {
            values.add(value.asText());
        }
        return values;
    }

    private static Map<String, String> textMap(JsonNode node, String name, String field) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new ConfigurationException("Service " + name + " field " + field + " must be a mapping");
        }
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            values.put(entry.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return values;
    }
}
