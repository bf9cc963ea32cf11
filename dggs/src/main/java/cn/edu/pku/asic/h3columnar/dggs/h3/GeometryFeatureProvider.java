package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.dggs.core.Feature;
import cn.edu.pku.asic.h3columnar.dggs.core.FeatureProvider;

public class GeometryFeatureProvider implements FeatureProvider {
    @Override
    public Feature getFeature() {
        return Feature.GEOMETRY;
    }

    @Override
    public String getDescription() {
        return "geometry kernels (" + GeometryKernels.class.getSimpleName() + ")";
    }
}
