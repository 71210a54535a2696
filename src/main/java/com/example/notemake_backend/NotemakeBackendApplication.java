package com.example.notemake_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class NotemakeBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(NotemakeBackendApplication.class, args);
	}

}
