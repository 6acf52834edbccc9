package com.partialspec;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PartialSpecApplication {

	public static void main(String[] args) {
        SpringApplication app = new SpringApplication(PartialSpecApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
	}

}
