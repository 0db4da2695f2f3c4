package com.flagship.telehealth_booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TelehealthBookingApplication {

    public static void main(String[] args) {
        SpringApplication.run(TelehealthBookingApplication.class, args);
    }
}
