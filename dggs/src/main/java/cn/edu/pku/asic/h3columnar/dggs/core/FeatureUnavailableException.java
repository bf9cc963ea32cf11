package cn.edu.pku.asic.h3columnar.dggs.core;

public class FeatureUnavailableException extends DggsException {

    private final Feature feature;

    public FeatureUnavailableException(Feature feature) {
        super("Feature " + feature + " is not available. Add its artifact to the classpath.");
        this.feature = feature;
    }

    public Feature getFeature() {
        return feature;
    }
}
