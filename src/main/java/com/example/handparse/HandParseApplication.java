package com.example.handparse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the hand history parsing service.
 * Wires the application context and exposes the REST endpoints under {@code /api/hands}.
 */
@SpringBootApplication
public class HandParseApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(HandParseApplication.class, args);
	}

}
