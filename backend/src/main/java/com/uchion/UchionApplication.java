package com.uchion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Uchion - validation and remediation of generated school worksheets.
 */
@SpringBootApplication
public class UchionApplication {

	public static void main(String[] args) {
		SpringApplication.run(UchionApplication.class, args);
	}

}
