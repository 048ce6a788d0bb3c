package com.costwatch.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CostAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnomalyApplication.class, args);
    }
}
