package cn.edu.pku.asic.h3columnar.dggs.core;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Lists the features that are available on the classpath. Callers check a feature before using the kernels
 * that belong to it instead of assuming they exist.
 */
public final class Features {

    private static final Log LOG = LogFactory.getLog(Features.class);

    private static volatile Map<Feature, FeatureProvider> providers;

    private Features() { /* Enforce static use only */ }

    private static Map<Feature, FeatureProvider> getProviders() {
        if (providers == null) {
            synchronized (Features.class) {
                if (providers == null) {
                    Map<Feature, FeatureProvider> found = new EnumMap<>(Feature.class);
                    for (FeatureProvider provider : ServiceLoader.load(FeatureProvider.class, Features.class.getClassLoader())) {
                        found.putIfAbsent(provider.getFeature(), provider);
                        LOG.debug("Found feature " + provider.getDescription());
                    }
                    providers = Collections.unmodifiableMap(found);
                }
            }
        }
        return providers;
    }

    public static boolean isAvailable(Feature feature) {
        return getProviders().containsKey(feature);
    }

    /**
     * Fails if the given feature is not on the classpath.
     * @param feature the feature to check
     * @throws FeatureUnavailableException if the feature is missing
     */
    public static void require(Feature feature) {
        if (!isAvailable(feature))
            throw new FeatureUnavailableException(feature);
    }

    public static Set<Feature> available() {
        return getProviders().keySet();
    }
}
