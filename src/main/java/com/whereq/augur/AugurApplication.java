package com.whereq.augur;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Augur.
 * This service runs analysis and prediction plugins asynchronously over time series
 * and publishes forecasts to an NGSI-LD context broker.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class AugurApplication {

    public static void main(String[] args) {
        SpringApplication.run(AugurApplication.class, args);
    }
}
