package com.lazyframe.runtime;

/**
 * Detects hardware capabilities used to size the worker pool.
 *
 * <p>Example usage:
 * <pre>
 *   HardwareProfile profile = HardwareProfile.detect();
 *   int threads = profile.recommendedThreadCount();
 * </pre>
 *
 * @see ExecutionPool
 */
public class HardwareProfile {

    private final int cpuCores;

    private HardwareProfile(int cpuCores) {
        this.cpuCores = cpuCores;
    }

    /**
     * Detects the hardware profile of the current system.
     *
     * @return the detected hardware profile
     */
    public static HardwareProfile detect() {
        return new HardwareProfile(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Returns the recommended worker thread count.
     *
     * <p>Uses every available core, with a minimum of 1.
     *
     * @return the recommended thread count
     */
    public int recommendedThreadCount() {
        return Math.max(1, cpuCores);
    }
}
