package io.github.riemr.duty;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DutyAssignmentApplication {

	public static void main(String[] args) {
		SpringApplication.run(DutyAssignmentApplication.class, args);
	}

}
