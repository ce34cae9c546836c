package com.di.chunkpilot.agent.profiler;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * Reads available memory from the host and from the container's cgroup, whichever is tighter.
 * Host memory is {@code MemAvailable} from {@code /proc/meminfo}, which counts reclaimable page
 * cache; the OS bean's free size is the fallback. Supports cgroup v2 ({@code memory.max} / {@code memory.current}) and v1
 * ({@code memory/memory.limit_in_bytes} / {@code memory/memory.usage_in_bytes}).
 */
@Slf4j
public class MemoryProbe {

    static final long FALLBACK_BYTES = 1L << 30;
    /** Limits at or above this are "unlimited" (v1 reports ~2^63 rounded to the page size). */
    private static final long ABSURD_LIMIT_BYTES = 1L << 60;

    private static final String MEM_AVAILABLE = "MemAvailable:";

    private final Path cgroupRoot;
    private final Path meminfo;
    private final OptionalLong hostOverride;

    public MemoryProbe() {
        this(Path.of("/sys/fs/cgroup"), Path.of("/proc/meminfo"), OptionalLong.empty());
    }

    MemoryProbe(Path cgroupRoot, OptionalLong hostOverride) {
        this(cgroupRoot, Path.of("/proc/meminfo"), hostOverride);
    }

    MemoryProbe(Path cgroupRoot, Path meminfo, OptionalLong hostOverride) {
        this.cgroupRoot = cgroupRoot;
        this.meminfo = meminfo;
        this.hostOverride = hostOverride;
    }

    /** Bytes that can still be allocated; never below 1. Falls back to 1 GiB when nothing is readable. */
    public long availableBytes() {
        OptionalLong host = hostAvailableBytes();
        OptionalLong container = containerHeadroomBytes();
        long available;
        if (host.isPresent() && container.isPresent()) {
            available = Math.min(host.getAsLong(), container.getAsLong());
        } else if (host.isPresent()) {
            available = host.getAsLong();
        } else if (container.isPresent()) {
            available = container.getAsLong();
        } else {
            log.warn("[PROFILER] Neither host nor container memory readable; assuming {} bytes", FALLBACK_BYTES);
            available = FALLBACK_BYTES;
        }
        return Math.max(1L, available);
    }

    OptionalLong hostAvailableBytes() {
        if (hostOverride.isPresent()) {
            return hostOverride;
        }
        OptionalLong memAvailable = memAvailableBytes();
        if (memAvailable.isPresent()) {
            return memAvailable;
        }
        try {
            if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean os) {
                long free = os.getFreeMemorySize();
                return free > 0 ? OptionalLong.of(free) : OptionalLong.empty();
            }
        } catch (RuntimeException e) {
            log.debug("[PROFILER] Host memory not readable: {}", e.getMessage());
        }
        return OptionalLong.empty();
    }

    /** {@code MemAvailable} in bytes; empty when the file or the line is missing. */
    OptionalLong memAvailableBytes() {
        if (!Files.isReadable(meminfo)) {
            return OptionalLong.empty();
        }
        try (Stream<String> lines = Files.lines(meminfo)) {
            return lines.filter(line -> line.startsWith(MEM_AVAILABLE))
                    .findFirst()
                    .map(MemoryProbe::parseKilobytes)
                    .orElse(OptionalLong.empty());
        } catch (IOException | UncheckedIOException e) {
            log.debug("[PROFILER] Unreadable {}: {}", meminfo, e.getMessage());
            return OptionalLong.empty();
        }
    }

    private static OptionalLong parseKilobytes(String line) {
        String[] parts = line.substring(MEM_AVAILABLE.length()).trim().split("\\s+");
        try {
            long kb = Long.parseLong(parts[0]);
            return kb > 0 ? OptionalLong.of(kb * 1024L) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            log.debug("[PROFILER] Malformed meminfo line '{}'", line);
            return OptionalLong.empty();
        }
    }

    /** Limit minus usage of the enclosing cgroup; empty when there is no ceiling. */
    OptionalLong containerHeadroomBytes() {
        OptionalLong v2 = headroom(cgroupRoot.resolve("memory.max"), cgroupRoot.resolve("memory.current"));
        if (v2.isPresent()) {
            return v2;
        }
        Path v1 = cgroupRoot.resolve("memory");
        return headroom(v1.resolve("memory.limit_in_bytes"), v1.resolve("memory.usage_in_bytes"));
    }

    private OptionalLong headroom(Path limitFile, Path usageFile) {
        OptionalLong limit = readBytes(limitFile);
        if (limit.isEmpty() || limit.getAsLong() <= 0 || limit.getAsLong() >= ABSURD_LIMIT_BYTES) {
            return OptionalLong.empty();
        }
        long usage = readBytes(usageFile).orElse(0L);
        return OptionalLong.of(Math.max(0L, limit.getAsLong() - usage));
    }

    private static OptionalLong readBytes(Path file) {
        if (!Files.isReadable(file)) {
            return OptionalLong.empty();
        }
        try {
            String raw = Files.readString(file).trim();
            if (raw.isEmpty() || "max".equals(raw)) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(Long.parseLong(raw));
        } catch (IOException | NumberFormatException e) {
            log.debug("[PROFILER] Unreadable cgroup file {}: {}", file, e.getMessage());
            return OptionalLong.empty();
        }
    }
}
