package com.techStack.authCore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.security.SecureRandom;
import java.time.Clock;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AuthCoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(AuthCoreApplication.class, args);
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public SecureRandom secureRandom() {
		return new SecureRandom();
	}
}
