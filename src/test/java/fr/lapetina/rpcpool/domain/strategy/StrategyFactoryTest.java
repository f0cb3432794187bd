package fr.lapetina.rpcpool.domain.strategy;

import fr.lapetina.rpcpool.exception.ConfigurationException;
import fr.lapetina.rpcpool.infrastructure.http.JsonRpcTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyFactoryTest {

    private static final List<String> URLS = List.of(
            "https://a.example",
            "https://b.example",
            "https://a.example"
    );

    @Nested
    @DisplayName("Strategy selection")
    class StrategySelection {

        @Test
        @DisplayName("should create fallback strategy")
        void shouldCreateFallback() {
            RequestStrategy strategy = StrategyFactory.create(StrategyConfig.fallback(URLS));

            assertThat(strategy).isInstanceOf(FallbackStrategy.class);
            assertThat(strategy.getName()).isEqualTo("fallback");
        }

        @Test
        @DisplayName("should create parallel strategy")
        void shouldCreateParallel() {
            RequestStrategy strategy = StrategyFactory.create(StrategyConfig.parallel(URLS));

            assertThat(strategy).isInstanceOf(ParallelStrategy.class);
            assertThat(strategy.getType()).isEqualTo(StrategyType.PARALLEL);
        }

        @Test
        @DisplayName("should reject a missing strategy type")
        void shouldRejectMissingType() {
            assertThatThrownBy(() -> StrategyFactory.create(new StrategyConfig(null, URLS)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Unknown strategy type");
        }

        @Test
        @DisplayName("should reject an unknown strategy name")
        void shouldRejectUnknownName() {
            assertThatThrownBy(() -> StrategyConfig.of("round-robin", URLS))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Unknown strategy type: round-robin");
        }

        @ParameterizedTest
        @ValueSource(strings = {"parallel", "PARALLEL", " Parallel "})
        @DisplayName("should parse strategy names case-insensitively")
        void shouldParseNames(String name) {
            assertThat(StrategyType.fromName(name)).isEqualTo(StrategyType.PARALLEL);
        }
    }

    @Nested
    @DisplayName("Transport creation")
    class TransportCreation {

        @Test
        @DisplayName("should reject an empty URL list")
        void shouldRejectEmptyUrls() {
            assertThatThrownBy(() -> StrategyFactory.create(StrategyConfig.fallback(List.of())))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("At least one RPC URL must be provided");
        }

        @Test
        @DisplayName("should create one transport per URL in order, duplicates included")
        void shouldKeepOrderAndDuplicates() {
            RequestStrategy strategy = StrategyFactory.create(StrategyConfig.parallel(URLS));

            assertThat(strategy.getTransports())
                    .extracting(JsonRpcTransport::getUrl)
                    .containsExactlyElementsOf(URLS);
            assertThat(strategy.getTransports().get(0))
                    .isNotSameAs(strategy.getTransports().get(2));
        }

        @Test
        @DisplayName("should build transports through the given factory")
        void shouldUseTransportFactory() {
            List<String> created = new ArrayList<>();

            RequestStrategy strategy = StrategyFactory.create(StrategyConfig.fallback(URLS), url -> {
                created.add(url);
                return StubTransport.returning(url, "\"0x1\"");
            });

            assertThat(created).containsExactlyElementsOf(URLS);
            assertThat(strategy.getTransports()).allMatch(StubTransport.class::isInstance);
        }

        @Test
        @DisplayName("should start every transport with a fresh request id")
        void shouldStartWithFreshIds() {
            RequestStrategy strategy = StrategyFactory.create(StrategyConfig.fallback(URLS));

            assertThat(strategy.getTransports())
                    .extracting(JsonRpcTransport::getRequestId)
                    .containsOnly(0L);
        }
    }
}
