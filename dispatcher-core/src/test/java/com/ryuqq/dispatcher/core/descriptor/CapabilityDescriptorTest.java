package com.ryuqq.dispatcher.core.descriptor;

import com.ryuqq.dispatcher.core.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CapabilityDescriptor / Capabilities / Mechanism 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class CapabilityDescriptorTest {

    @Test
    void noMatch_설명을_담은_noOp_서비스() {
        CapabilityDescriptor descriptor = CapabilityDescriptor.noMatch("no operations can be performed on C1");

        assertThat(descriptor.isNoMatch()).isTrue();
        assertThat(descriptor.name()).isEqualTo(CapabilityDescriptor.NO_MATCH_NAME);
        assertThat(descriptor.mechanism()).isEqualTo(Mechanism.NO_OP);
        assertThat(descriptor.explanation()).isEqualTo("no operations can be performed on C1");
        assertThat(descriptor.capabilities().outputFormats()).containsExactly("application/json");
    }

    @Test
    void env와_params는_선언_순서를_유지하고_변경_불가() {
        // given
        Map<String, String> env = new LinkedHashMap<>();
        env.put("ZEBRA", "1");
        env.put("APPLE", "2");
        env.put("MANGO", "3");
        Map<String, String> params = new LinkedHashMap<>();
        params.put("image", "harmony/gdal:latest");
        params.put("api", "v2");

        // when
        CapabilityDescriptor descriptor = new CapabilityDescriptor("svc", Mechanism.LOCAL_PROCESS, List.of("C1"),
            Capabilities.none(), params, env, null, null);
        env.put("LATE", "4");

        // then
        assertThat(descriptor.env().keySet()).containsExactly("ZEBRA", "APPLE", "MANGO");
        assertThat(descriptor.params().keySet()).containsExactly("image", "api");
        assertThatThrownBy(() -> descriptor.env().put("X", "Y"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void servesAll_모든_컬렉션을_포함할_때만_true() {
        CapabilityDescriptor descriptor = CapabilityDescriptor.of(
            "svc", Mechanism.HTTP, List.of("C1", "C2"), Capabilities.none(), Map.of());

        assertThat(descriptor.servesAll(List.of("C1"))).isTrue();
        assertThat(descriptor.servesAll(List.of("C2", "C1"))).isTrue();
        assertThat(descriptor.servesAll(List.of("C1", "C3"))).isFalse();
    }

    @Test
    void requireParam_없으면_IllegalStateException() {
        CapabilityDescriptor descriptor = CapabilityDescriptor.of(
            "svc", Mechanism.HTTP, List.of("C1"), Capabilities.none(), Map.of("url", "http://svc"));

        assertThat(descriptor.requireParam("url")).isEqualTo("http://svc");
        assertThatThrownBy(() -> descriptor.requireParam("image"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("svc")
            .hasMessageContaining("image");
    }

    @Test
    void 생성자_이름이_없으면_예외() {
        assertThatThrownBy(() -> CapabilityDescriptor.of(" ", Mechanism.HTTP, List.of(), null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void firstFormatAccepting_선언_순서의_첫_형식() {
        Capabilities capabilities = new Capabilities(
            List.of("image/tiff", "image/png", "application/x-netcdf4"), false, false, false, false);

        assertThat(capabilities.firstFormatAccepting("image/*")).isEqualTo("image/tiff");
        assertThat(capabilities.firstFormatAccepting("*/*")).isEqualTo("image/tiff");
        assertThat(capabilities.firstFormatAccepting("image/png")).isEqualTo("image/png");
        assertThat(capabilities.firstFormatAccepting("image/gif")).isNull();
    }

    @Test
    void requiresAsynchronizer_단일단위_또는_동기전용() {
        assertThat(new Capabilities(List.of(), false, false, true, false).requiresAsynchronizer()).isTrue();
        assertThat(new Capabilities(List.of(), false, false, false, true).requiresAsynchronizer()).isTrue();
        assertThat(Capabilities.none().requiresAsynchronizer()).isFalse();
    }

    @Test
    void fromTag_별칭을_포함해_변환() {
        assertThat(Mechanism.fromTag("http")).isEqualTo(Mechanism.HTTP);
        assertThat(Mechanism.fromTag("docker")).isEqualTo(Mechanism.LOCAL_PROCESS);
        assertThat(Mechanism.fromTag("argo")).isEqualTo(Mechanism.WORKFLOW);
        assertThat(Mechanism.fromTag("workflow")).isEqualTo(Mechanism.WORKFLOW);
        assertThat(Mechanism.fromTag("noOp")).isEqualTo(Mechanism.NO_OP);
    }

    @Test
    void fromTag_알수없는_태그면_ConfigurationException() {
        assertThatThrownBy(() -> Mechanism.fromTag("ftp"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("ftp");
    }
}
