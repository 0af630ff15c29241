package com.z254.robi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * ROBI - session backend for a companion robot.
 *
 * <p>ROBI provides:
 * <ul>
 *   <li>Duplex sessions - authenticated WebSocket turns streaming emotion, speech text and motion</li>
 *   <li>Tag decoding - control tags stripped from model output as it streams</li>
 *   <li>Memory - privacy-gated facts about people and places, compacted over time</li>
 *   <li>Zone graph - known rooms, learned paths and the robot's current location</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class RobiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RobiApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
