package com.poolintel.schedule;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class PoolScheduleApplication {

    public static void main(String[] args) {
        SpringApplication.run(PoolScheduleApplication.class, args);
    }
}
