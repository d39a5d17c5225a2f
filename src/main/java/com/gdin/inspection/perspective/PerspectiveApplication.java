package com.gdin.inspection.perspective;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PerspectiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerspectiveApplication.class, args);
    }
}
