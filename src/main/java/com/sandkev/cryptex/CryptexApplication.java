package com.sandkev.cryptex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CryptexApplication {

	public static void main(String[] args) {
		SpringApplication.run(CryptexApplication.class, args);
	}

}
