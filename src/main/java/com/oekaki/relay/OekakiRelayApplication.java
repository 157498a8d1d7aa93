package com.oekaki.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OekakiRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(OekakiRelayApplication.class, args);
    }
}
