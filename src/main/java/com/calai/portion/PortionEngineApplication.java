package com.calai.portion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortionEngineApplication.class, args);
    }
}
