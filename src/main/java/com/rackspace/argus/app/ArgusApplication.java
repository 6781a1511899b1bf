package com.rackspace.argus.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArgusApplication {

	public static void main(String[] args) {
		SpringApplication.run(ArgusApplication.class, args);
	}

}
