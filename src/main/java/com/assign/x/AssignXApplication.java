package com.assign.x;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssignXApplication {

	public static void main(String[] args) {
		SpringApplication.run(AssignXApplication.class, args);
	}

}
