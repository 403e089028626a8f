package com.trendrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrendrankApplication {

	public static void main(String[] args) {
		SpringApplication.run(TrendrankApplication.class, args);
	}

}
