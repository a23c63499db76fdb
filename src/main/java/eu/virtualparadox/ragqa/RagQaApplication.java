package eu.virtualparadox.ragqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RagQaApplication {

    public static void main(final String[] args) {
        SpringApplication.run(RagQaApplication.class, args);
    }
}
