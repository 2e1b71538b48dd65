package com.example.trackscribe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrackscribeApplication {

	public static void main(String[] args) {
		SpringApplication.run(TrackscribeApplication.class, args);
	}

}
