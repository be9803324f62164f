package com.study.webflux.memory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemoryEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(MemoryEngineApplication.class, args);
	}
}
