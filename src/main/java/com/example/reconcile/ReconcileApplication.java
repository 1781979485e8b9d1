package com.example.reconcile;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point for the reconciliation core.
 * This class only wires the application context; callers drive the statement, extraction and
 * matching services directly.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReconcileApplication {

	/**
	 * Boots the Spring container with the parsing, extraction and matching services.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(ReconcileApplication.class, args);
	}

}
