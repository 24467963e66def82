package com.journeynsw.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JourneyNswApplication {

	public static void main(String[] args) {
		SpringApplication.run(JourneyNswApplication.class, args);
	}

}
