package com.ramgenix.swingscanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SwingScannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SwingScannerApplication.class, args);
	}

}
