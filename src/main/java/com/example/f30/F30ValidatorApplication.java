package com.example.f30;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point of the F30 certificate validator.
 * Only wires the application context and hands over control to Spring.
 */
@SpringBootApplication
public class F30ValidatorApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(F30ValidatorApplication.class, args);
	}

}
