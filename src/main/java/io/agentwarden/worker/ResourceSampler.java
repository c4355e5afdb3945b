package io.agentwarden.worker;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * CPU and heap usage of the current JVM, reported with every heartbeat.
 */
public final class ResourceSampler {
    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

    public Sample sample() {
        double cpu = 0.0d;
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            double load = ((com.sun.management.OperatingSystemMXBean) os).getProcessCpuLoad();
            if (load >= 0.0d) {
                cpu = load * 100.0d;
            }
        }
        Runtime rt = Runtime.getRuntime();
        return new Sample(cpu, rt.totalMemory() - rt.freeMemory());
    }

    public record Sample(double cpuPercent, long memoryBytes) {
    }
}
