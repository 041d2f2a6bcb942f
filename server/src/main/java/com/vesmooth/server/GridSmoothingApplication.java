package com.vesmooth.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GridSmoothingApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridSmoothingApplication.class, args);
    }
}
