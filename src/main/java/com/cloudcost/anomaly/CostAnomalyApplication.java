package com.cloudcost.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CostAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnomalyApplication.class, args);
    }
}
