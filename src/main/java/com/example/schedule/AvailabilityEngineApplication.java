package com.example.schedule;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.example.schedule.repository")
public class AvailabilityEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(AvailabilityEngineApplication.class, args);
	}

}
