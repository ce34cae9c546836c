package com.di.chunkpilot.agent.sampler;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chunkpilot.sampler")
public class SamplerProperties {

    @Min(1)
    @Max(10_000)
    private int sampleSize = 5;
    /** Thread count growth below this is treated as noise when detecting nested parallelism. */
    @Min(1)
    private int internalThreadNoise = 2;

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public int getInternalThreadNoise() {
        return internalThreadNoise;
    }

    public void setInternalThreadNoise(int internalThreadNoise) {
        this.internalThreadNoise = internalThreadNoise;
    }
}
