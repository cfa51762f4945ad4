package fr.lapetina.genrouter.infrastructure.config;

import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.ProviderDescriptor;
import fr.lapetina.genrouter.domain.model.TierPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String VALID = """
            providers:
              - id: provider-a
                modality: text
                unitPrice: 0.000002
                priority: 1
                tiers: [pro]
              - id: provider-img
                modality: image
                unitPrice: 0.04
                creditWeight: 10
                enabled: false
            tiers:
              - id: pro
                providers: [provider-img]
                allowances:
                  text: 1000
                  image: -1
                usageIntensity:
                  text: 0.5
                unlimitedUsage:
                  image: 20
            """;

    private static RouterConfig parse(String yaml) {
        ConfigLoader loader = new ConfigLoader("unused.yaml");
        return loader.loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("should bind providers, tiers and defaults from YAML")
    void shouldBindYaml() {
        RouterConfig config = parse(VALID);

        assertThat(config.getProviders()).hasSize(2);
        RouterConfig.ProviderConfig provider = config.getProviders().get(0);
        assertThat(provider.getUnitPrice()).isEqualByComparingTo(new BigDecimal("0.000002"));
        assertThat(provider.getTiers()).containsExactly("pro");
        assertThat(config.getHealth().getFailureThreshold()).isEqualTo(3);
        assertThat(config.getPipeline().getRingBufferSize()).isEqualTo(1024);
        assertThat(config.getIdempotency().getTtlMs()).isEqualTo(600_000);
    }

    @Test
    @DisplayName("should map the catalog to descriptors and tier policies")
    void shouldMapCatalog() {
        RouterConfig config = parse(VALID);

        List<ProviderDescriptor> descriptors = CatalogMapper.toDescriptors(config, p -> () -> true);
        List<TierPolicy> tiers = CatalogMapper.toTierPolicies(config);

        assertThat(descriptors).extracting(ProviderDescriptor::getId).containsExactly("provider-a", "provider-img");
        assertThat(descriptors.get(0).getTimeout().toMillis()).isEqualTo(30_000);
        assertThat(descriptors.get(1).isLive()).as("disabled provider is never live").isFalse();

        TierPolicy pro = tiers.get(0);
        assertThat(pro.allowance(Modality.TEXT)).isEqualTo(1000);
        assertThat(pro.isUnlimited(Modality.IMAGE)).isTrue();
        assertThat(pro.intensity(Modality.TEXT)).isEqualTo(0.5);
        assertThat(pro.unlimitedUsage(Modality.IMAGE)).isEqualTo(20);
        assertThat(pro.providers()).containsExactly("provider-img");
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject duplicate provider ids")
        void shouldRejectDuplicateProviders() {
            assertThatThrownBy(() -> parse("""
                    providers:
                      - id: a
                        modality: text
                      - id: a
                        modality: text
                    """))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Duplicate provider id");
        }

        @Test
        @DisplayName("should reject a tier listing an unknown provider")
        void shouldRejectUnknownProviderInTier() {
            assertThatThrownBy(() -> parse("""
                    tiers:
                      - id: pro
                        providers: [ghost]
                    """))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("ghost");
        }

        @Test
        @DisplayName("should reject usage intensity outside [0, 1]")
        void shouldRejectIntensityOutOfRange() {
            assertThatThrownBy(() -> parse("""
                    tiers:
                      - id: pro
                        usageIntensity:
                          text: 1.5
                    """))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("usageIntensity");
        }

        @Test
        @DisplayName("should reject an unknown modality")
        void shouldRejectUnknownModality() {
            assertThatThrownBy(() -> parse("""
                    providers:
                      - id: a
                        modality: audio
                    """))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of 2")
        void shouldRejectRingBufferSize() {
            assertThatThrownBy(() -> parse("""
                    pipeline:
                      ringBufferSize: 1000
                    """))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("power of 2");
        }

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml() {
            assertThatThrownBy(() -> parse("providers: [ {id: a"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }

    @Test
    @DisplayName("should load from the classpath when no file exists")
    void shouldLoadFromClasspath() {
        RouterConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getProviders()).extracting(RouterConfig.ProviderConfig::getId)
                .contains("provider-a", "provider-b");
    }

    @Test
    @DisplayName("should notify listeners on reload and keep the current config on failure")
    void shouldReloadAndKeepCurrentOnFailure(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.yaml");
        Files.writeString(file, VALID);
        ConfigLoader loader = new ConfigLoader(file.toString());
        RouterConfig initial = loader.load();

        List<RouterConfig> seen = new ArrayList<>();
        loader.addListener((oldConfig, newConfig) -> seen.add(newConfig));

        Files.writeString(file, "pipeline:\n  ringBufferSize: 3\n");
        RouterConfig afterBadReload = loader.reload();

        assertThat(afterBadReload).isSameAs(initial);
        assertThat(seen).isEmpty();

        Files.writeString(file, VALID.replace("priority: 1", "priority: 7"));
        RouterConfig reloaded = loader.reload();

        assertThat(seen).containsExactly(reloaded);
        assertThat(reloaded.getProviders().get(0).getPriority()).isEqualTo(7);
        loader.close();
    }
}
