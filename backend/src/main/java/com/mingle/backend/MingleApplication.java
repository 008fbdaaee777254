package com.mingle.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MingleApplication {

	public static void main(String[] args) {
		// Post expiry is compared in UTC everywhere, logs included
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(MingleApplication.class, args);
	}

}
