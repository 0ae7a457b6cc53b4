package org.carball.pooltune.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PoolConfigurationPatchTest {

    private final PoolConfiguration base = PoolEnvironment.STAGING.buildConfiguration();

    @Test
    void shouldOverrideOnlySetFields() {
        PoolConfigurationPatch patch = PoolConfigurationPatch.builder()
                .maxConnections(40)
                .applicationTag("orders")
                .build();

        PoolConfiguration merged = patch.applyTo(base);

        assertThat(merged.getMaxConnections()).isEqualTo(40);
        assertThat(merged.getApplicationTag()).isEqualTo("orders");
        assertThat(merged.toBuilder().maxConnections(20).applicationTag("pooltune-staging").build()).isEqualTo(base);
    }

    @Test
    void fullPatchShouldReproduceConfiguration() {
        PoolConfigurationPatch patch = PoolConfigurationPatch.of(base);

        assertThat(patch.getMissingFields()).isEmpty();
        assertThat(patch.applyTo(PoolEnvironment.TEST.buildConfiguration())).isEqualTo(base);
    }

    @Test
    void shouldReportMissingFields() {
        PoolConfigurationPatch patch = PoolConfigurationPatch.builder().minConnections(1).build();

        assertThat(patch.getMissingFields()).hasSize(14).doesNotContain("minConnections");
        assertThat(patch.isEmpty()).isFalse();
        assertThat(new PoolConfigurationPatch().isEmpty()).isTrue();
    }

    @Test
    void shouldOmitUnsetFieldsInJson() throws Exception {
        String json = new ObjectMapper().writeValueAsString(PoolConfigurationPatch.builder().retryAttempts(7).build());

        assertThat(json).isEqualTo("{\"retryAttempts\":7}");
    }
}
