package com.prospectenhancer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProspectEnhancerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProspectEnhancerApplication.class, args);
    }
}
