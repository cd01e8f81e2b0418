package edustats.oecd.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EducationPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(EducationPipelineApplication.class, args);
    }
}
