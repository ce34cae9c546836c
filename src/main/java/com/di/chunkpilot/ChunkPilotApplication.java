package com.di.chunkpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChunkPilotApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChunkPilotApplication.class, args);
	}
}
