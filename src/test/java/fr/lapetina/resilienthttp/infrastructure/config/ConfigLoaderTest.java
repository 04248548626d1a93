package fr.lapetina.resilienthttp.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        ResilientHttpConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getRetry().getMaxRetries()).isEqualTo(3);
        assertThat(config.getRetry().getFailureCodes()).containsExactly(500, 503);
        assertThat(config.getRetry().getDelayUnit()).isEqualTo("millis");
        assertThat(config.getBatch().getRingBufferSize()).isEqualTo(64);
        assertThat(config.getBatch().getPollIntervalMs()).isEqualTo(5);
        assertThat(config.getTransport().getRequestTimeoutMs()).isEqualTo(2000);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("test_http");
    }

    @Test
    @DisplayName("should keep defaults for missing keys")
    void shouldKeepDefaultsForMissingKeys() {
        ResilientHttpConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml("""
                retry:
                  maxRetries: 7
                  failureCodes: [502]
                """));

        assertThat(config.getRetry().getMaxRetries()).isEqualTo(7);
        assertThat(config.getRetry().getFailureCodes()).containsExactly(502);
        assertThat(config.getRetry().getDelayStrategy()).isEqualTo("exponential");
        assertThat(config.getBatch().getRingBufferSize()).isEqualTo(1024);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("resilient_http");
    }

    @Test
    @DisplayName("should use defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        ResilientHttpConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml(""));

        assertThat(config.getRetry().getMaxRetries()).isEqualTo(3);
        assertThat(config.getBatch().getWaitStrategy()).isEqualTo("blocking");
    }

    @Test
    @DisplayName("should reject a ring buffer size that is not a power of two")
    void shouldRejectInvalidRingBuffer() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");

        assertThatThrownBy(() -> loader.loadFromStream(yaml("batch:\n  ringBufferSize: 1000\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("ringBufferSize");
    }

    @Test
    @DisplayName("should reject malformed YAML")
    void shouldRejectMalformedYaml() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");

        assertThatThrownBy(() -> loader.loadFromStream(yaml("retry: [unclosed")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
    }

    @Test
    @DisplayName("should fail when the file is nowhere to be found")
    void shouldFailWhenMissing() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should notify listeners with old and new configuration")
    void shouldNotifyListeners(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("client.yaml");
        Files.writeString(file, "retry:\n  maxRetries: 1\n");
        ConfigLoader loader = new ConfigLoader(file.toString());
        List<ResilientHttpConfig[]> changes = new ArrayList<>();
        loader.addListener((oldConfig, newConfig) -> changes.add(new ResilientHttpConfig[]{oldConfig, newConfig}));

        ResilientHttpConfig first = loader.load();
        Files.writeString(file, "retry:\n  maxRetries: 2\n");
        ResilientHttpConfig second = loader.reload();

        assertThat(second.getRetry().getMaxRetries()).isEqualTo(2);
        assertThat(changes).hasSize(2);
        assertThat(changes.get(0)[0]).isNull();
        assertThat(changes.get(1)[0]).isSameAs(first);
        assertThat(changes.get(1)[1]).isSameAs(second);
    }

    @Test
    @DisplayName("should keep the current configuration when a reload fails")
    void shouldKeepCurrentOnFailedReload(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("client.yaml");
        Files.writeString(file, "batch:\n  ringBufferSize: 32\n");
        ConfigLoader loader = new ConfigLoader(file.toString());
        ResilientHttpConfig loaded = loader.load();

        Files.writeString(file, "batch:\n  ringBufferSize: 33\n");

        assertThat(loader.reload()).isSameAs(loaded);
        assertThat(loader.getCurrentConfig().getBatch().getRingBufferSize()).isEqualTo(32);
    }

    @Test
    @DisplayName("should isolate a failing listener")
    void shouldIsolateFailingListener() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");
        List<ResilientHttpConfig> received = new ArrayList<>();
        loader.addListener((oldConfig, newConfig) -> {
            throw new IllegalStateException("listener failure");
        });
        loader.addListener((oldConfig, newConfig) -> received.add(newConfig));

        ResilientHttpConfig config = loader.loadFromStream(yaml(""));

        assertThat(received).containsExactly(config);
    }
}
