package com.ryuqq.dispatcher.adapter.invoker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.dispatcher.core.model.BoundingBox;
import com.ryuqq.dispatcher.core.model.Granule;
import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.Source;
import com.ryuqq.dispatcher.core.model.TemporalRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * OperationSerializer 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class OperationSerializerTest {

    private final OperationSerializer serializer = new OperationSerializer();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void serialize_모든_필드() throws Exception {
        // given
        Operation operation = Operation.builder(OpId.of("job-1"), "http://localhost/cb")
            .source(Source.of("C1", List.of("red_var"), List.of(Granule.of("G1", "g1.nc", "s3://b/g1.nc"))))
            .boundingBox(BoundingBox.of(-130, -45, 130, 45))
            .temporal(TemporalRange.of(Instant.parse("2020-01-01T00:00:00Z"), null))
            .outputFormat("image/png")
            .build();

        // when
        JsonNode json = mapper.readTree(serializer.serialize(operation));

        // then
        assertThat(json.get("requestId").asText()).isEqualTo("job-1");
        assertThat(json.get("callback").asText()).isEqualTo("http://localhost/cb");
        JsonNode source = json.get("sources").get(0);
        assertThat(source.get("collection").asText()).isEqualTo("C1");
        assertThat(source.get("variables").get(0).asText()).isEqualTo("red_var");
        assertThat(source.get("granules").get(0).get("url").asText()).isEqualTo("s3://b/g1.nc");
        assertThat(json.get("format").get("mime").asText()).isEqualTo("image/png");
        assertThat(json.get("format").get("bbox")).hasSize(4);
        assertThat(json.get("format").get("bbox").get(0).asDouble()).isEqualTo(-130.0);
        assertThat(json.get("temporal").get("start").asText()).isEqualTo("2020-01-01T00:00:00Z");
        assertThat(json.get("temporal").has("end")).isFalse();
    }

    @Test
    void serialize_선택_필드가_없으면_생략() throws Exception {
        Operation operation = Operation.builder(OpId.of("job-1"), "http://localhost/cb")
            .source(Source.of("C1"))
            .build();

        JsonNode json = mapper.readTree(serializer.serialize(operation));

        assertThat(json.has("format")).isFalse();
        assertThat(json.has("temporal")).isFalse();
        assertThat(json.get("sources").get(0).has("variables")).isFalse();
    }
}
