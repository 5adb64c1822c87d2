package com.ryuqq.dispatcher.adapter.inmemory.channel;

import com.ryuqq.dispatcher.core.exception.SubmissionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryMessageChannel 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class InMemoryMessageChannelTest {

    private InMemoryMessageChannel channel;

    @BeforeEach
    void setUp() {
        channel = new InMemoryMessageChannel();
    }

    @Test
    void publish_채널별_FIFO() throws SubmissionException {
        channel.publish("q1", "m1");
        channel.publish("q1", "m2");
        channel.publish("q2", "other");

        assertThat(channel.dequeue("q1", 10)).containsExactly("m1", "m2");
        assertThat(channel.size("q1")).isZero();
        assertThat(channel.size("q2")).isEqualTo(1);
    }

    @Test
    void dequeue_batchSize만큼만() throws SubmissionException {
        channel.publish("q1", "m1");
        channel.publish("q1", "m2");

        assertThat(channel.dequeue("q1", 1)).containsExactly("m1");
        assertThat(channel.dequeue("unknown", 1)).isEmpty();
        assertThatThrownBy(() -> channel.dequeue("q1", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void publish_거부_모드면_SubmissionException() {
        channel.setRejecting(true);

        assertThatThrownBy(() -> channel.publish("q1", "m1"))
            .isInstanceOf(SubmissionException.class)
            .hasMessageContaining("q1");
        assertThat(channel.size("q1")).isZero();
    }

    @Test
    void clear_거부_모드도_해제() throws SubmissionException {
        channel.setRejecting(true);

        channel.clear();
        channel.publish("q1", "m1");

        assertThat(channel.size("q1")).isEqualTo(1);
    }
}
