package com.example.posematch_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PosematchBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(PosematchBackendApplication.class, args);
	}

}
