package com.di.chunkpilot.agent.profiler;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
public final class SystemProbe {

    static final Path CPUINFO = Path.of("/proc/cpuinfo");

    private SystemProbe() {}

    /** Logical processors (override with -Dchunkpilot.cores or env CHUNKPILOT_CORES). */
    public static int detectLogicalCores() {
        Integer override = coresOverride();
        if (override != null) {
            return override;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Physical cores: the override when set, else unique (physical id, core id) pairs in
     * /proc/cpuinfo, capped by the processors this JVM may use; logical count otherwise.
     */
    public static int detectPhysicalCores() {
        Integer override = coresOverride();
        if (override != null) {
            return override;
        }
        int logical = detectLogicalCores();
        int physical = physicalCoresFromCpuinfo(CPUINFO);
        return physical > 0 ? Math.min(physical, logical) : logical;
    }

    /** JVM max heap bytes (override with -Dchunkpilot.heap.bytes or env CHUNKPILOT_HEAP_BYTES). */
    public static long detectMaxHeapBytes() {
        String o = System.getProperty("chunkpilot.heap.bytes", System.getenv("CHUNKPILOT_HEAP_BYTES"));
        if (o != null && !o.isBlank()) {
            try {
                return Math.max(64L << 20, Long.parseLong(o.trim()));
            } catch (NumberFormatException e) {
                log.warn("[PROFILER] Ignoring invalid heap override '{}'", o);
            }
        }
        return Runtime.getRuntime().maxMemory();
    }

    static int physicalCoresFromCpuinfo(Path cpuinfo) {
        if (!Files.isReadable(cpuinfo)) {
            return 0;
        }
        try {
            return countCores(Files.readAllLines(cpuinfo));
        } catch (IOException e) {
            log.debug("[PROFILER] Could not read {}: {}", cpuinfo, e.getMessage());
            return 0;
        }
    }

    static int countCores(List<String> lines) {
        Set<String> cores = new HashSet<>();
        String physicalId = "0";
        String coreId = null;
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (line.isBlank()) {
                if (coreId != null) {
                    cores.add(physicalId + "/" + coreId);
                }
                physicalId = "0";
                coreId = null;
            } else if (colon > 0) {
                String key = line.substring(0, colon).trim();
                String value = line.substring(colon + 1).trim();
                if ("physical id".equals(key)) {
                    physicalId = value;
                } else if ("core id".equals(key)) {
                    coreId = value;
                }
            }
        }
        if (coreId != null) {
            cores.add(physicalId + "/" + coreId);
        }
        return cores.size();
    }

    private static Integer coresOverride() {
        String o = System.getProperty("chunkpilot.cores", System.getenv("CHUNKPILOT_CORES"));
        if (o == null || o.isBlank()) {
            return null;
        }
        try {
            return Math.max(1, Integer.parseInt(o.trim()));
        } catch (NumberFormatException e) {
            log.warn("[PROFILER] Ignoring invalid cores override '{}'", o);
            return null;
        }
    }
}
