package fr.lapetina.rpcpool.infrastructure.config;

import fr.lapetina.rpcpool.domain.strategy.StrategyConfig;
import fr.lapetina.rpcpool.domain.strategy.StrategyType;
import fr.lapetina.rpcpool.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("should load configuration from classpath")
        void shouldLoadFromClasspath() {
            ConfigLoader loader = new ConfigLoader("test-config.yaml");

            RpcPoolConfig config = loader.load();

            assertThat(config.getStrategy()).isEqualTo("parallel");
            assertThat(config.getRpcUrls()).containsExactly(
                    "https://rpc-a.example/v1/key-a",
                    "https://rpc-b.example:8545");
            assertThat(config.getTimeouts().getConnectTimeoutMs()).isEqualTo(2000);
            assertThat(config.getTimeouts().getRequestTimeoutMs()).isEqualTo(5000);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_rpc");
            assertThat(loader.getCurrentConfig()).isSameAs(config);
        }

        @Test
        @DisplayName("should apply defaults for omitted sections")
        void shouldApplyDefaults() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");

            RpcPoolConfig config = loader.loadFromStream(yaml("rpcUrls: [\"https://a.example\"]\n"));

            assertThat(config.getStrategy()).isEqualTo("fallback");
            assertThat(config.getTimeouts().getConnectTimeoutMs()).isEqualTo(10000);
            assertThat(config.getTimeouts().getRequestTimeoutMs()).isEqualTo(30000);
            assertThat(config.getMetrics().isEnabled()).isTrue();
            assertThat(config.getMetrics().getPrefix()).isEqualTo("rpc_pool");
        }

        @Test
        @DisplayName("should convert to a strategy configuration")
        void shouldConvertToStrategyConfig() {
            RpcPoolConfig config = new ConfigLoader("test-config.yaml").load();

            StrategyConfig strategyConfig = config.toStrategyConfig();

            assertThat(strategyConfig.type()).isEqualTo(StrategyType.PARALLEL);
            assertThat(strategyConfig.rpcUrls()).hasSize(2);
        }

        @Test
        @DisplayName("should fail when the file is nowhere to be found")
        void shouldFailOnMissingFile() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Configuration file not found");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        private final ConfigLoader loader = new ConfigLoader("unused.yaml");

        @Test
        @DisplayName("should reject an empty URL list")
        void shouldRejectEmptyUrls() {
            assertThatThrownBy(() -> loader.loadFromStream(yaml("strategy: fallback\nrpcUrls: []\n")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("At least one RPC URL must be provided");
        }

        @Test
        @DisplayName("should reject a blank URL")
        void shouldRejectBlankUrl() {
            assertThatThrownBy(() -> loader.loadFromStream(yaml("rpcUrls: [\"https://a.example\", \" \"]\n")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("blank");
        }

        @Test
        @DisplayName("should reject an unknown strategy")
        void shouldRejectUnknownStrategy() {
            assertThatThrownBy(() -> loader.loadFromStream(yaml("strategy: race\nrpcUrls: [\"https://a.example\"]\n")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Unknown strategy type: race");
        }

        @Test
        @DisplayName("should reject a non-positive connect timeout")
        void shouldRejectConnectTimeout() {
            String content = "rpcUrls: [\"https://a.example\"]\ntimeouts:\n  connectTimeoutMs: 0\n";

            assertThatThrownBy(() -> loader.loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("connectTimeoutMs");
        }

        @Test
        @DisplayName("should reject a negative request timeout")
        void shouldRejectRequestTimeout() {
            String content = "rpcUrls: [\"https://a.example\"]\ntimeouts:\n  requestTimeoutMs: -1\n";

            assertThatThrownBy(() -> loader.loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("requestTimeoutMs");
        }

        @Test
        @DisplayName("should reject malformed YAML and empty documents")
        void shouldRejectMalformedYaml() {
            assertThatThrownBy(() -> loader.loadFromStream(yaml("rpcUrls: [unclosed\n")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Invalid configuration");
            assertThatThrownBy(() -> loader.loadFromStream(yaml("")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("empty");
        }

        @Test
        @DisplayName("should not replace the current configuration when validation fails")
        void shouldKeepCurrentOnFailure() {
            RpcPoolConfig valid = loader.loadFromStream(yaml("rpcUrls: [\"https://a.example\"]\n"));

            assertThatThrownBy(() -> loader.loadFromStream(yaml("rpcUrls: []\n")))
                    .isInstanceOf(ConfigurationException.class);
            assertThat(loader.getCurrentConfig()).isSameAs(valid);
        }
    }

    @Nested
    @DisplayName("Reload")
    class Reload {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should notify listeners with old and new configuration")
        void shouldNotifyListeners() throws Exception {
            Path file = tempDir.resolve("rpc-pool.yaml");
            Files.writeString(file, "strategy: fallback\nrpcUrls: [\"https://a.example\"]\n");
            List<String> changes = new ArrayList<>();

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                loader.load();
                loader.addListener((oldConfig, newConfig) ->
                        changes.add(oldConfig.getStrategy() + "->" + newConfig.getStrategy()));

                Files.writeString(file, "strategy: parallel\nrpcUrls: [\"https://a.example\"]\n");
                RpcPoolConfig reloaded = loader.reload();

                assertThat(reloaded.getStrategy()).isEqualTo("parallel");
                assertThat(changes).containsExactly("fallback->parallel");
            }
        }

        @Test
        @DisplayName("should reload automatically when the watched file changes")
        void shouldReloadOnFileChange() throws Exception {
            Path file = tempDir.resolve("rpc-pool.yaml");
            Files.writeString(file, "strategy: fallback\nrpcUrls: [\"https://a.example\"]\n");
            CountDownLatch reloaded = new CountDownLatch(1);
            AtomicReference<RpcPoolConfig> received = new AtomicReference<>();

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                loader.load();
                loader.addListener((oldConfig, newConfig) -> {
                    received.set(newConfig);
                    reloaded.countDown();
                });
                loader.startWatching();

                Files.writeString(file, "strategy: parallel\nrpcUrls: [\"https://a.example\"]\n");
                // Some file systems keep second-level mtimes; move it past the loaded one
                Files.setLastModifiedTime(file, FileTime.fromMillis(System.currentTimeMillis() + 5000));

                assertThat(reloaded.await(15, TimeUnit.SECONDS)).isTrue();
                assertThat(received.get().getStrategy()).isEqualTo("parallel");
                assertThat(loader.getCurrentConfig().getStrategy()).isEqualTo("parallel");
            }
        }

        @Test
        @DisplayName("should keep the current configuration when the new file is invalid")
        void shouldKeepCurrentOnInvalidReload() throws Exception {
            Path file = tempDir.resolve("rpc-pool.yaml");
            Files.writeString(file, "strategy: fallback\nrpcUrls: [\"https://a.example\"]\n");
            List<RpcPoolConfig> notified = new ArrayList<>();

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                RpcPoolConfig original = loader.load();
                loader.addListener((oldConfig, newConfig) -> notified.add(newConfig));

                Files.writeString(file, "strategy: unknown\nrpcUrls: [\"https://a.example\"]\n");
                RpcPoolConfig afterReload = loader.reload();

                assertThat(afterReload).isSameAs(original);
                assertThat(loader.getCurrentConfig()).isSameAs(original);
                assertThat(notified).isEmpty();
            }
        }
    }
}
