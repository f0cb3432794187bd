package fr.lapetina.rpcpool.domain.strategy;

import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static fr.lapetina.rpcpool.domain.strategy.StubTransport.json;
import static org.assertj.core.api.Assertions.assertThat;

class ResponseFingerprintTest {

    @Test
    @DisplayName("should ignore object key order at every level")
    void shouldIgnoreKeyOrder() {
        String first = ResponseFingerprint.of(json("{\"b\":1,\"a\":{\"y\":[1,2],\"x\":null}}"));
        String second = ResponseFingerprint.of(json("{\"a\":{\"x\":null,\"y\":[1,2]},\"b\":1}"));

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("should keep array order significant")
    void shouldKeepArrayOrder() {
        assertThat(ResponseFingerprint.of(json("[1,2]")))
                .isNotEqualTo(ResponseFingerprint.of(json("[2,1]")));
    }

    @Test
    @DisplayName("should tell different values apart")
    void shouldDistinguishValues() {
        assertThat(ResponseFingerprint.of(json("\"0x1\"")))
                .isNotEqualTo(ResponseFingerprint.of(json("\"0x2\"")));
        assertThat(ResponseFingerprint.of(json("1")))
                .isNotEqualTo(ResponseFingerprint.of(json("\"1\"")));
    }

    @Test
    @DisplayName("should fingerprint null and JSON null alike")
    void shouldFingerprintNull() {
        assertThat(ResponseFingerprint.of(null))
                .isEqualTo(ResponseFingerprint.of(NullNode.getInstance()));
        assertThat(ResponseFingerprint.canonicalize(null)).isEqualTo("null");
    }

    @Test
    @DisplayName("should serialize objects with sorted keys")
    void shouldCanonicalize() {
        assertThat(ResponseFingerprint.canonicalize(json("{\"number\":\"0x10\",\"hash\":\"0xaa\"}")))
                .isEqualTo("{\"hash\":\"0xaa\",\"number\":\"0x10\"}");
    }

    @Test
    @DisplayName("should match known FNV-1a 64 values")
    void shouldMatchFnvVectors() {
        assertThat(ResponseFingerprint.fnv1a64(new byte[0])).isEqualTo(0xcbf29ce484222325L);
        assertThat(ResponseFingerprint.fnv1a64("a".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(0xaf63dc4c8601ec8cL);
    }
}
