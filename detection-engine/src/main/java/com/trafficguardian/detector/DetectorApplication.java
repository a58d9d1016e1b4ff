package com.trafficguardian.detector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Traffic Guardian Detection Engine.
 *
 * <p>
 * Spring Boot application that normalizes heterogeneous network traffic
 * sources into canonical records, derives numeric features, scores them with
 * an ensemble of two outlier models, and retrains the ensemble from analyst
 * feedback.
 * </p>
 *
 * @author Naveed Gung
 */
@SpringBootApplication
@EnableScheduling
public class DetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DetectorApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
