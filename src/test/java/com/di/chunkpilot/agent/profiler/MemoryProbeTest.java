package com.di.chunkpilot.agent.profiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MemoryProbe Tests")
class MemoryProbeTest {

    @TempDir
    Path cgroup;

    @Test
    @DisplayName("cgroup v2 headroom is limit minus usage")
    void cgroupV2_headroom() throws IOException {
        Files.writeString(cgroup.resolve("memory.max"), "1073741824\n");
        Files.writeString(cgroup.resolve("memory.current"), "73741824\n");
        MemoryProbe probe = new MemoryProbe(cgroup, OptionalLong.of(8L << 30));

        assertEquals(1_000_000_000L, probe.availableBytes());
    }

    @Test
    @DisplayName("cgroup v2 'max' means no container ceiling")
    void cgroupV2_unlimited() throws IOException {
        Files.writeString(cgroup.resolve("memory.max"), "max\n");
        MemoryProbe probe = new MemoryProbe(cgroup, OptionalLong.of(123_456L));

        assertTrue(probe.containerHeadroomBytes().isEmpty());
        assertEquals(123_456L, probe.availableBytes());
    }

    @Test
    @DisplayName("cgroup v1 files are read when v2 is absent")
    void cgroupV1_headroom() throws IOException {
        Path v1 = Files.createDirectories(cgroup.resolve("memory"));
        Files.writeString(v1.resolve("memory.limit_in_bytes"), "2000");
        Files.writeString(v1.resolve("memory.usage_in_bytes"), "500");
        MemoryProbe probe = new MemoryProbe(cgroup, OptionalLong.of(1L << 40));

        assertEquals(1500L, probe.availableBytes());
    }

    @Test
    @DisplayName("cgroup v1 unlimited sentinel is ignored")
    void cgroupV1_absurdLimitIgnored() throws IOException {
        Path v1 = Files.createDirectories(cgroup.resolve("memory"));
        Files.writeString(v1.resolve("memory.limit_in_bytes"), "9223372036854771712");
        MemoryProbe probe = new MemoryProbe(cgroup, OptionalLong.of(4096L));

        assertEquals(4096L, probe.availableBytes());
    }

    @Test
    @DisplayName("Host memory wins when it is tighter than the container")
    void hostTighterThanContainer() throws IOException {
        Files.writeString(cgroup.resolve("memory.max"), "1000000");
        MemoryProbe probe = new MemoryProbe(cgroup, OptionalLong.of(1000L));

        assertEquals(1000L, probe.availableBytes());
    }

    @Test
    @DisplayName("Host memory is MemAvailable from meminfo, page cache included")
    void meminfo_memAvailable() throws IOException {
        Path meminfo = Files.writeString(cgroup.resolve("meminfo"), String.join("\n",
                "MemTotal:       16384000 kB",
                "MemFree:          512000 kB",
                "MemAvailable:    5398868 kB",
                "Buffers:          204800 kB",
                ""));
        MemoryProbe probe = new MemoryProbe(cgroup.resolve("no-cgroup"), meminfo, OptionalLong.empty());

        assertEquals(5_398_868L * 1024, probe.hostAvailableBytes().orElseThrow());
        assertEquals(5_398_868L * 1024, probe.availableBytes());
    }

    @Test
    @DisplayName("Container ceiling still wins over a larger MemAvailable")
    void meminfo_containerTighter() throws IOException {
        Path meminfo = Files.writeString(cgroup.resolve("meminfo"), "MemAvailable:    8000000 kB\n");
        Files.writeString(cgroup.resolve("memory.max"), "4096");
        MemoryProbe probe = new MemoryProbe(cgroup, meminfo, OptionalLong.empty());

        assertEquals(4096L, probe.availableBytes());
    }

    @Test
    @DisplayName("Meminfo without MemAvailable falls back to the OS free size")
    void meminfo_missingLine_fallsBack() throws IOException {
        Path meminfo = Files.writeString(cgroup.resolve("meminfo"), "MemTotal:       16384000 kB\n");
        MemoryProbe probe = new MemoryProbe(cgroup.resolve("no-cgroup"), meminfo, OptionalLong.empty());

        assertTrue(probe.memAvailableBytes().isEmpty());
        assertTrue(probe.availableBytes() > 0);
    }

    @Test
    @DisplayName("Real host probe returns a positive value")
    void realProbe_positive() {
        assertTrue(new MemoryProbe().availableBytes() > 0);
    }
}
