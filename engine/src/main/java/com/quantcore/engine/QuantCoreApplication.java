package com.quantcore.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuantCoreApplication {
	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(QuantCoreApplication.class);
		application.setWebApplicationType(WebApplicationType.NONE);
		application.run(args);
	}
}
