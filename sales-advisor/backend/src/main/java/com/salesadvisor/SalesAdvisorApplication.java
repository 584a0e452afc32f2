package com.salesadvisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesAdvisorApplication.class, args);
    }
}
