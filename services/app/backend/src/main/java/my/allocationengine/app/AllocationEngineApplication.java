package my.allocationengine.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AllocationEngineApplication {
	public static void main(String[] args) {
		SpringApplication.run(AllocationEngineApplication.class, args);
	}
}
