package cn.edu.pku.asic.h3columnar.dggs.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeaturesTest {

    @Test
    void coreFeaturesAreAlwaysAvailable() {
        assertThat(Features.isAvailable(Feature.HIERARCHY)).isTrue();
        assertThat(Features.isAvailable(Feature.GEOMETRY)).isTrue();
        Features.require(Feature.GEOMETRY);
    }

    @Test
    void optionalFeaturesNeedTheirArtifact() {
        // The raster and indexing artifacts are not on the test classpath of this module
        assertThat(Features.available()).doesNotContain(Feature.RASTER, Feature.SPATIAL_INDEX);
        assertThatThrownBy(() -> Features.require(Feature.RASTER))
            .isInstanceOf(FeatureUnavailableException.class)
            .hasMessageContaining("RASTER");
    }
}
