package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;

/**
 * What to do with invalid values while building a cell array from raw input.
 */
public enum IngestPolicy {
    /** Fail the whole call on the first invalid value */
    REJECT,
    /** Replace invalid values with nulls and count them */
    NULL_OUT;

    /**
     * Reads the policy configured under {@link KernelOptions#IngestPolicy}
     * @param opts the options
     * @return the configured policy, {@link #REJECT} if not set
     */
    public static IngestPolicy fromOptions(KernelOptions opts) {
        String value = opts.get(KernelOptions.IngestPolicy, REJECT.name());
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ingest policy '" + value + "' in "
                + KernelOptions.IngestPolicy, e);
        }
    }
}
