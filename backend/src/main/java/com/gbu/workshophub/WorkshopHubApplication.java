package com.gbu.workshophub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkshopHubApplication {

	public static void main(String[] args) {
		SpringApplication.run(WorkshopHubApplication.class, args);
	}
}
