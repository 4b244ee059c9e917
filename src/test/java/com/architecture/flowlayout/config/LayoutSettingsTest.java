package com.architecture.flowlayout.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LayoutSettingsTest {

    @Test
    void acceptsDefaults() {
        LayoutSettings settings = LayoutSettings.defaults().validate();

        assertThat(settings.getGatewaySize()).isEqualTo(60);
        assertThat(settings.getMaxSweeps()).isEqualTo(4);
    }

    @Test
    void rejectsZeroTopMargin() {
        LayoutSettings settings = LayoutSettings.defaults().toBuilder().marginY(0).build();

        assertThatThrownBy(settings::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("marginY");
    }

    @Test
    void rejectsNegativeSweepCount() {
        LayoutSettings settings = LayoutSettings.defaults().toBuilder().maxSweeps(-1).build();

        assertThatThrownBy(settings::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsInvertedScaleRange_onlyWhenScalingIsEnabled() {
        LayoutSettings inverted = LayoutSettings.defaults().toBuilder().minScale(2.0).maxScale(1.0).build();

        assertThatThrownBy(inverted::validate).isInstanceOf(IllegalArgumentException.class);
        assertThat(inverted.toBuilder().scaleEnabled(false).build().validate()).isNotNull();
    }
}
