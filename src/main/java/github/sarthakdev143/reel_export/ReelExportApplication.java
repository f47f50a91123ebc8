package github.sarthakdev143.reel_export;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReelExportApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReelExportApplication.class, args);
	}

}
