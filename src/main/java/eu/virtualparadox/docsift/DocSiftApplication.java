package eu.virtualparadox.docsift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DocSiftApplication {

    public static void main(final String[] args) {
        SpringApplication.run(DocSiftApplication.class, args);
    }
}
