package de.mirkosertic.naivecmp.config;

import de.mirkosertic.naivecmp.ConfigurationException;
import de.mirkosertic.naivecmp.report.ReportFormat;
import de.mirkosertic.naivecmp.scan.FingerprintAttributes;
import de.mirkosertic.naivecmp.scan.ScanSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    private static void loadYaml(final ApplicationConfig config, final String yaml) {
        config.loadFromYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Should use modification time and size by default")
        void shouldUseDefaultAttributes() {
            final ApplicationConfig config = ApplicationConfig.defaults();

            assertThat(config.getFingerprintAttributes()).isEqualTo(FingerprintAttributes.defaults());
            assertThat(config.getWorkers()).isEqualTo(ScanSettings.DEFAULT_WORKER_COUNT);
            assertThat(config.getQueueCapacity()).isEqualTo(ScanSettings.DEFAULT_QUEUE_CAPACITY);
            assertThat(config.getSeed()).isNull();
            assertThat(config.getReportFormat()).isEqualTo(ReportFormat.TEXT);
            assertThat(config.isDebug()).isFalse();
        }

        @Test
        @DisplayName("Should use the run seed unless a seed is configured")
        void shouldChooseSeed() {
            final ApplicationConfig config = ApplicationConfig.defaults();

            assertThat(config.toScanSettings(17L).seed()).isEqualTo(17L);

            config.setSeed(3L);
            assertThat(config.toScanSettings(17L).seed()).isEqualTo(3L);
        }

        @Test
        @DisplayName("Should locate the user config below the home directory")
        void shouldLocateUserConfig() {
            assertThat(ApplicationConfig.getUserConfigPath().toString())
                    .endsWith(".naivecmp" + java.io.File.separator + "config.yaml");
        }
    }

    @Nested
    @DisplayName("YAML")
    class YamlTests {

        @Test
        @DisplayName("Should read compare and report sections")
        void shouldReadSections() {
            // Given
            final ApplicationConfig config = ApplicationConfig.defaults();

            // When
            loadYaml(config, """
                    naivecmp:
                      compare:
                        workers: 3
                        queue-capacity: 16
                        seed: 12345
                        attributes:
                          modification-time: false
                          name: true
                      report:
                        format: json
                        debug: true
                    """);

            // Then
            assertThat(config.getWorkers()).isEqualTo(3);
            assertThat(config.getQueueCapacity()).isEqualTo(16);
            assertThat(config.getSeed()).isEqualTo(12345L);
            assertThat(config.getFingerprintAttributes())
                    .isEqualTo(new FingerprintAttributes(false, true, false, true, false));
            assertThat(config.getReportFormat()).isEqualTo(ReportFormat.JSON);
            assertThat(config.isDebug()).isTrue();
        }

        @Test
        @DisplayName("Should keep values not present in the file")
        void shouldKeepMissingValues() {
            final ApplicationConfig config = ApplicationConfig.defaults();

            loadYaml(config, "other:\n  key: value\n");

            assertThat(config.getWorkers()).isEqualTo(ScanSettings.DEFAULT_WORKER_COUNT);
            assertThat(config.getFingerprintAttributes()).isEqualTo(FingerprintAttributes.defaults());
        }

        @Test
        @DisplayName("Should reject an unknown report format")
        void shouldRejectUnknownFormat() {
            final ApplicationConfig config = ApplicationConfig.defaults();

            assertThatThrownBy(() -> loadYaml(config, "naivecmp:\n  report:\n    format: xml\n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("xml");
        }
    }

    @Nested
    @DisplayName("Overrides")
    class OverrideTests {

        @Test
        @DisplayName("Should let environment variables win over system properties")
        void shouldPreferEnvironment() {
            // Given
            final ApplicationConfig config = ApplicationConfig.defaults();
            final Properties properties = new Properties();
            properties.setProperty(ApplicationConfig.PROP_WORKERS, "4");
            properties.setProperty(ApplicationConfig.PROP_REPORT_FORMAT, "json");
            final Map<String, String> environment = Map.of(ApplicationConfig.ENV_WORKERS, "9");

            // When
            config.applyOverrides(environment::get, properties);

            // Then
            assertThat(config.getWorkers()).isEqualTo(9);
            assertThat(config.getReportFormat()).isEqualTo(ReportFormat.JSON);
        }

        @Test
        @DisplayName("Should ignore blank values")
        void shouldIgnoreBlankValues() {
            final ApplicationConfig config = ApplicationConfig.defaults();

            config.applyOverrides(Map.of(ApplicationConfig.ENV_WORKERS, "  ")::get, new Properties());

            assertThat(config.getWorkers()).isEqualTo(ScanSettings.DEFAULT_WORKER_COUNT);
        }

        @Test
        @DisplayName("Should reject a non-numeric worker count")
        void shouldRejectNonNumericWorkers() {
            final ApplicationConfig config = ApplicationConfig.defaults();

            assertThatThrownBy(() -> config.applyOverrides(Map.of(ApplicationConfig.ENV_WORKERS, "many")::get, new Properties()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining(ApplicationConfig.ENV_WORKERS);
        }

        @Test
        @DisplayName("Should reject a non-positive worker count when building scan settings")
        void shouldRejectNonPositiveWorkers() {
            final ApplicationConfig config = ApplicationConfig.defaults();
            config.setWorkers(-1);

            assertThatThrownBy(() -> config.toScanSettings(1L))
                    .isInstanceOf(ConfigurationException.class);
        }
    }
}
