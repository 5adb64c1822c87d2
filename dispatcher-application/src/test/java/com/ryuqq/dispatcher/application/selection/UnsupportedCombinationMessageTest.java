package com.ryuqq.dispatcher.application.selection;

import com.ryuqq.dispatcher.core.model.BoundingBox;
import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;
import com.ryuqq.dispatcher.core.model.Source;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * UnsupportedCombinationMessage 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class UnsupportedCombinationMessageTest {

    @Test
    void listToText_항목_수에_따른_연결() {
        assertThat(UnsupportedCombinationMessage.listToText(List.of())).isEmpty();
        assertThat(UnsupportedCombinationMessage.listToText(List.of("a"))).isEqualTo("a");
        assertThat(UnsupportedCombinationMessage.listToText(List.of("a", "b"))).isEqualTo("a and b");
        assertThat(UnsupportedCombinationMessage.listToText(List.of("a", "b", "c"))).isEqualTo("a, b, and c");
    }

    @Test
    void build_모든_요청_작업과_모든_컬렉션을_나열() {
        // given
        Operation operation = Operation.builder(OpId.of("job-1"), "http://localhost/cb")
            .source(Source.of("C1", List.of("v1"), List.of()))
            .source(Source.of("C2"))
            .boundingBox(BoundingBox.of(0, 0, 1, 1))
            .build();

        // when
        String message = UnsupportedCombinationMessage.build(operation, RequestContext.of("image/png", "image/tiff", "*/*"));

        // then
        assertThat(message).isEqualTo("the requested combination of operations: variable subsetting, spatial subsetting, "
            + "and reformatting to image/png and image/tiff on C1 and C2 is unsupported");
    }

    @Test
    void build_와일드카드만_요청하면_형식_변환으로_보지_않는다() {
        Operation operation = Operation.builder(OpId.of("job-1"), "http://localhost/cb")
            .source(Source.of("C1"))
            .build();

        String message = UnsupportedCombinationMessage.build(operation, RequestContext.of("*", "*/*"));

        assertThat(message).isEqualTo("no operations can be performed on C1");
    }

    @Test
    void build_Operation의_형식이_컨텍스트보다_우선() {
        Operation operation = Operation.builder(OpId.of("job-1"), "http://localhost/cb")
            .source(Source.of("C1"))
            .outputFormat("image/gif")
            .build();

        String message = UnsupportedCombinationMessage.build(operation, RequestContext.of("image/png"));

        assertThat(message).isEqualTo("the requested combination of operations: reformatting to image/gif on C1 is unsupported");
    }
}
