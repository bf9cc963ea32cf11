package cn.edu.pku.asic.h3columnar.dggs.h3;

/**
 * How to combine the distances at which one cell is reached from several origins.
 */
public enum KAggregation {
    MIN,
    MAX;

    public static KAggregation fromString(String name) {
        switch (name.trim().toLowerCase()) {
            case "min":
                return MIN;
            case "max":
                return MAX;
            default:
                throw new IllegalArgumentException("Unknown way to aggregate k '" + name + "'");
        }
    }

    int combine(int k1, int k2) {
        return this == MIN ? Math.min(k1, k2) : Math.max(k1, k2);
    }
}
