package com.optura;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OpturaApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(OpturaApplication.class);
        app.setDefaultProperties(java.util.Map.of("spring.main.banner-mode", "off"));
        app.run(args);
    }
}
