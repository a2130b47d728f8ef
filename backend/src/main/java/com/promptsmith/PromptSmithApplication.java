package com.promptsmith;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PromptSmith - multi-phase prompt analysis and improvement.
 */
@SpringBootApplication
@EnableScheduling
public class PromptSmithApplication {

	public static void main(String[] args) {
		SpringApplication.run(PromptSmithApplication.class, args);
	}

}
