package com.elssolution.powermonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class PowerMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PowerMonitorApplication.class, args);
    }

}
