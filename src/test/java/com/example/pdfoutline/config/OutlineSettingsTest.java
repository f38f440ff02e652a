package com.example.pdfoutline.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OutlineSettings")
class OutlineSettingsTest {

    @Test
    @DisplayName("Defaults carry the documented weights")
    void defaults() {
        OutlineSettings settings = OutlineSettings.defaults();

        assertThat(settings.getSizeWeight()).isEqualTo(0.5);
        assertThat(settings.getBoldWeight()).isEqualTo(0.2);
        assertThat(settings.getIsolationWeight()).isEqualTo(0.15);
        assertThat(settings.getLengthPenalty()).isEqualTo(0.3);
        assertThat(settings.getMaxClusters()).isEqualTo(4);
        assertThat(settings.isDropTitleDuplicates()).isFalse();
    }

    @Test
    @DisplayName("Rejects inconsistent values")
    void rejectsInvalid() {
        assertThatThrownBy(() -> OutlineSettings.builder().maxClusters(5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxClusters");
        assertThatThrownBy(() -> OutlineSettings.builder().acceptanceMin(0.7).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OutlineSettings.builder().sizeSaturationRatio(1.0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OutlineSettings.builder().batchThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
