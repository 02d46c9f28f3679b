package com.pointbreak.award;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PointBreakApplication {

	public static void main(String[] args) {
		SpringApplication.run(PointBreakApplication.class, args);
	}

}
