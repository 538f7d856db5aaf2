package io.daylit.roi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class RoiApplication {

	public static void main(String[] args) {
		SpringApplication.run(RoiApplication.class, args);
		log.info("... Application started Successfully ...");
	}
}
