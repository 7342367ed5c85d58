package com.purchasingpower.itemgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class ItemGraphIngestApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ItemGraphIngestApplication.class, args);
        if (context.getEnvironment().getProperty("itemgraph.run-on-startup", Boolean.class, false)) {
            // one-shot mode: exit with the run's status code
            System.exit(SpringApplication.exit(context));
        }
    }
}
