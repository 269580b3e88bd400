package io.databrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DataBrain: shared, persistent knowledge graph for a fleet of agents,
 * with decay and replay export scheduled through JobRunr.
 */
@SpringBootApplication
public class DataBrainApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataBrainApplication.class, args);
    }
}
