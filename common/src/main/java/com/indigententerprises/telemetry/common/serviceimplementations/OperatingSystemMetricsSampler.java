package com.indigententerprises.telemetry.common.serviceimplementations;

import com.indigententerprises.telemetry.common.domain.SystemMetrics;
import com.indigententerprises.telemetry.common.serviceinterfaces.MetricsSampler;

import com.sun.management.OperatingSystemMXBean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * System wide CPU and memory from the platform MXBean, network byte counters summed over
 * every interface listed in {@code /proc/net/dev}.
 */
public final class OperatingSystemMetricsSampler implements MetricsSampler {

    private static final Logger log = LoggerFactory.getLogger(OperatingSystemMetricsSampler.class);

    private static final Path NET_DEV = Path.of("/proc/net/dev");

    private final OperatingSystemMXBean operatingSystem;
    private final Path netDev;

    public OperatingSystemMetricsSampler() {
        this(ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class), NET_DEV);
    }

    public OperatingSystemMetricsSampler(final OperatingSystemMXBean operatingSystem, final Path netDev) {
        this.operatingSystem = operatingSystem;
        this.netDev = netDev;
    }

    @Override
    public void prime() {
        cpuPercent();
    }

    @Override
    public SystemMetrics sample() {
        final long[] traffic = traffic();
        return new SystemMetrics(cpuPercent(), memPercent(), traffic[0], traffic[1]);
    }

    private double cpuPercent() {
        if (operatingSystem == null) {
            return 0.0;
        } else {
            final double load = operatingSystem.getCpuLoad();
            // negative while the platform has no reading yet
            return load < 0 ? 0.0 : load * 100.0;
        }
    }

    private double memPercent() {
        if (operatingSystem == null) {
            return 0.0;
        } else {
            final long total = operatingSystem.getTotalMemorySize();
            final long free = operatingSystem.getFreeMemorySize();
            return total <= 0 ? 0.0 : (total - free) * 100.0 / total;
        }
    }

    private long[] traffic() {
        try {
            return parseNetDev(Files.readAllLines(netDev, StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException e) {
            log.debug("network counters unavailable from {}", netDev, e);
            return new long[] {0L, 0L};
        }
    }

    /**
     * @return received and transmitted byte totals across all interfaces
     */
    static long[] parseNetDev(final List<String> lines) {
        // mutable data
        long received = 0L;
        long transmitted = 0L;

        for (final String line : lines) {
            final int colon = line.indexOf(':');

            // the two header lines carry '|' and no interface name
            if (colon < 0 || line.indexOf('|') >= 0) {
                continue;
            }

            final String[] fields = line.substring(colon + 1).trim().split("\\s+");

            if (fields.length >= 9) {
                received += Long.parseLong(fields[0]);
                transmitted += Long.parseLong(fields[8]);
            }
        }

        return new long[] {received, transmitted};
    }
}
