package com.specsim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SpecSim - standard-document to semantic intermediate model service.
 */
@SpringBootApplication
public class SpecSimApplication {

	public static void main(String[] args) {
		SpringApplication.run(SpecSimApplication.class, args);
	}

}
