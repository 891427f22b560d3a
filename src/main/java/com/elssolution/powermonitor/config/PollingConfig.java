package com.elssolution.powermonitor.config;

import com.elssolution.powermonitor.polling.HttpMeterClient;
import com.elssolution.powermonitor.polling.MeterClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/** Separate HTTP clients for the reading and the energy pollers. */
@Configuration
public class PollingConfig {

    @Value("${poller.reading.connectTimeoutMs:3000}") private long readingConnectTimeoutMs;
    @Value("${poller.reading.requestTimeoutMs:5000}") private long readingRequestTimeoutMs;
    @Value("${poller.energy.connectTimeoutMs:3000}")  private long energyConnectTimeoutMs;
    @Value("${poller.energy.requestTimeoutMs:10000}") private long energyRequestTimeoutMs;

    @Bean
    public MeterClient readingMeterClient(ObjectMapper objectMapper, Clock clock) {
        return new HttpMeterClient("reading", Duration.ofMillis(readingConnectTimeoutMs),
                Duration.ofMillis(readingRequestTimeoutMs), objectMapper, clock);
    }

    @Bean
    public MeterClient energyMeterClient(ObjectMapper objectMapper, Clock clock) {
        return new HttpMeterClient("energy", Duration.ofMillis(energyConnectTimeoutMs),
                Duration.ofMillis(energyRequestTimeoutMs), objectMapper, clock);
    }
}
