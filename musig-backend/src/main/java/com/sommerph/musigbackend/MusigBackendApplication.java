package com.sommerph.musigbackend;

import com.sommerph.musigbackend.config.MultisigProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MultisigProperties.class)
public class MusigBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(MusigBackendApplication.class, args);
	}

}
