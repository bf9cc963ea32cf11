package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.dggs.core.Feature;
import cn.edu.pku.asic.h3columnar.dggs.core.FeatureProvider;

public class HierarchyFeatureProvider implements FeatureProvider {
    @Override
    public Feature getFeature() {
        return Feature.HIERARCHY;
    }

    @Override
    public String getDescription() {
        return "hierarchy and neighborhood kernels (" + HierarchyKernels.class.getSimpleName() + ", "
            + GridKernels.class.getSimpleName() + ")";
    }
}
