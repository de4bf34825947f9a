package com.browseflow.browseflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BrowseflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrowseflowBackendApplication.class, args);
    }
}
