package eu.virtualparadox.docembed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocEmbedApplication {

    public static void main(final String[] args) {
        SpringApplication.run(DocEmbedApplication.class, args);
    }
}
