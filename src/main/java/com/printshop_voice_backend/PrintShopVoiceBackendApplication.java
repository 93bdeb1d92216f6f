package com.printshop_voice_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrintShopVoiceBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(PrintShopVoiceBackendApplication.class, args);
	}

}
