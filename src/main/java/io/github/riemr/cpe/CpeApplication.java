package io.github.riemr.cpe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CpeApplication {

	public static void main(String[] args) {
		SpringApplication.run(CpeApplication.class, args);
	}

}
