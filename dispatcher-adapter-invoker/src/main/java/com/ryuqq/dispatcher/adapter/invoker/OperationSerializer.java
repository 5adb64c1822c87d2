package com.ryuqq.dispatcher.adapter.invoker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.dispatcher.core.model.BoundingBox;
import com.ryuqq.dispatcher.core.model.Granule;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.Source;
import com.ryuqq.dispatcher.core.model.TemporalRange;

/**
 * Operation JSON 직렬화.
 *
 * <p>모든 전송 방식(HTTP 본문, 프로세스 인자, 큐 메시지, 워크플로 입력)이 같은 표현을 씁니다.
 * null 필드는 생략됩니다.</p>
 *
 * <pre>
 * {
 *   "requestId": "job-1",
 *   "callback": "http://localhost:3000/service/job-1",
 *   "sources": [{"collection": "C1", "variables": ["red_var"],
 *                "granules": [{"id": "G1", "name": "g1.nc", "url": "s3://..."}]}],
 *   "format": {"mime": "image/png", "bbox": [-130, -45, 130, 45]},
 *   "temporal": {"start": "2020-01-01T00:00:00Z", "end": "2020-01-02T00:00:00Z"}
 * }
 * </pre>
 *
 * <p>Thread-safe.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class OperationSerializer {

    private final ObjectMapper mapper;

    public OperationSerializer() {
        this(new ObjectMapper());
    }

    public OperationSerializer(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper.copy().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Operation을 JSON 문자열로 변환.
     *
     * @param operation 직렬화할 Operation
     * @return JSON 문자열
     * @throws JsonProcessingException 직렬화 실패 시
     */
    public String serialize(Operation operation) throws JsonProcessingException {
        return mapper.writeValueAsString(toTree(operation));
    }

    ObjectNode toTree(Operation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        ObjectNode root = mapper.createObjectNode();
        root.put("requestId", operation.getOpId().getValue());
        root.put("callback", operation.getCallback());

        ArrayNode sources = root.putArray("sources");
        for (Source source : operation.getSources()) {
            ObjectNode node = sources.addObject();
            node.put("collection", source.collection());
            if (source.hasVariables()) {
                ArrayNode variables = node.putArray("variables");
                source.variables().forEach(variables::add);
            }
            ArrayNode granules = node.putArray("granules");
            for (Granule granule : source.granules()) {
                ObjectNode granuleNode = granules.addObject();
                granuleNode.put("id", granule.id());
                if (granule.name() != null) {
                    granuleNode.put("name", granule.name());
                }
                granuleNode.put("url", granule.url());
            }
        }

        ObjectNode format = mapper.createObjectNode();
        if (operation.getOutputFormat() != null) {
            format.put("mime", operation.getOutputFormat());
        }
        BoundingBox bbox = operation.getBoundingBox();
        if (bbox != null) {
            format.putArray("bbox").add(bbox.west()).add(bbox.south()).add(bbox.east()).add(bbox.north());
        }
        if (!format.isEmpty()) {
            root.set("format", format);
        }

        TemporalRange temporal = operation.getTemporal();
        if (temporal != null) {
            ObjectNode temporalNode = root.putObject("temporal");
            if (temporal.start() != null) {
                temporalNode.put("start", temporal.start().toString());
            }
            if (temporal.end() != null) {
                temporalNode.put("end", temporal.end().toString());
            }
        }
        return root;
    }
}
