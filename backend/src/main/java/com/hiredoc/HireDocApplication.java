package com.hiredoc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * HireDoc - hiring document classification, extraction and validation.
 */
@SpringBootApplication
public class HireDocApplication {

	public static void main(String[] args) {
		SpringApplication.run(HireDocApplication.class, args);
	}

}
