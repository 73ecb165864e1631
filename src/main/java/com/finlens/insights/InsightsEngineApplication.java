package com.finlens.insights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InsightsEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(InsightsEngineApplication.class, args);
	}

}
