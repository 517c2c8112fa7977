package io.github.riemr.roster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RosterEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(RosterEngineApplication.class, args);
	}

}
