package com.example.pageedit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the page edit service.
 * This class lives in the API/bootstrap layer and only wires the application context
 * before handing control to Spring.
 */
@SpringBootApplication
public class PageEditApplication {

	/**
	 * Boots the Spring container and exposes the page, document and folder endpoints.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(PageEditApplication.class, args);
	}

}
