package cn.edu.pku.asic.h3columnar.dggs.core;

/**
 * Registered in {@code META-INF/services} by every artifact that ships a {@link Feature}.
 */
public interface FeatureProvider {

    Feature getFeature();

    /**
     * A short human readable description used in logs
     */
    default String getDescription() {
        return getFeature().name();
    }
}
