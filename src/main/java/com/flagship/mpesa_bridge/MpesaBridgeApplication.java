package com.flagship.mpesa_bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MpesaBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MpesaBridgeApplication.class, args);
    }
}
