package fr.lapetina.genrouter;

import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.domain.model.OrchestrationResult;
import fr.lapetina.genrouter.integration.TestRouterFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RouterFactoryTest {

    private static final String TWO_PROVIDERS = """
            providers:
              - id: provider-a
                modality: text
                unitPrice: 0.000002
                priority: 1
                tiers: [pro]
              - id: provider-b
                modality: text
                unitPrice: 0.000001
                priority: 2
                tiers: [pro]
            tiers:
              - id: pro
                allowances:
                  text: 100000
            metrics:
              prefix: reload_test
            """;

    private static final String ONE_PROVIDER = """
            providers:
              - id: provider-b
                modality: text
                unitPrice: 0.000003
                priority: 2
                tiers: [pro]
            tiers:
              - id: pro
                allowances:
                  text: 100000
            metrics:
              prefix: reload_test
            """;

    @TempDir
    Path tempDir;

    private Path write(String name, String yaml) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    @DisplayName("should swap the catalog when the configuration is reloaded")
    void shouldApplyReloadedCatalog() throws Exception {
        Path config = write("router.yaml", TWO_PROVIDERS);
        try (TestRouterFactory router = TestRouterFactory.createStopped(config.toString())) {
            router.getHealthTracker().forceOpen("provider-a");

            Files.writeString(config, ONE_PROVIDER);
            router.getConfigLoader().reload();

            assertThat(router.getRegistry().getProvider("provider-a")).isEmpty();
            assertThat(router.getRegistry().getProvider("provider-b").orElseThrow().getUnitPrice())
                    .isEqualByComparingTo("0.000003");
            assertThat(router.getOrchestrator().hasAdapter("provider-a")).isFalse();
            assertThat(router.getHealthTracker().snapshot()).containsKey("provider-a");

            OrchestrationResult result = router.getOrchestrator().execute(GenerationRequest.text("pro", "hello"));
            assertThat(result.providerId()).isEqualTo("provider-b");
        }
    }

    @Test
    @DisplayName("should keep the current catalog when the new configuration is invalid")
    void shouldKeepCatalogOnInvalidReload() throws Exception {
        Path config = write("router.yaml", TWO_PROVIDERS);
        try (TestRouterFactory router = TestRouterFactory.createStopped(config.toString())) {
            Files.writeString(config, TWO_PROVIDERS.replace("unitPrice: 0.000001", "unitPrice: -1"));
            router.getConfigLoader().reload();

            assertThat(router.getRegistry().size()).isEqualTo(2);
            assertThat(router.getConfig().getProviders()).hasSize(2);
        }
    }

    @Test
    @DisplayName("should never route to a provider that has no endpoint")
    void shouldSkipProvidersWithoutEndpoint() throws Exception {
        Path config = write("router.yaml", TWO_PROVIDERS);
        try (RouterFactory router = RouterFactory.create(config.toString())) {
            assertThat(router.getRegistry().candidatesFor(Modality.TEXT, "pro")).isEmpty();

            OrchestrationResult result = router.getOrchestrator().execute(GenerationRequest.text("pro", "hello"));

            assertThat(result.failureKind()).isEqualTo(FailureKind.NO_ELIGIBLE_PROVIDER);
        }
    }

    @Test
    @DisplayName("should project costs from the loaded catalog")
    void shouldProjectCostsFromCatalog() {
        try (TestRouterFactory router = TestRouterFactory.createStopped("test-config.yaml")) {
            assertThat(router.getCostEstimator().estimate("free").perUserCost()).isEqualByComparingTo("0.0005");
            assertThat(router.getCostEstimator().estimate("premium").perUserCost()).isEqualByComparingTo("3.0");
        }
    }
}
