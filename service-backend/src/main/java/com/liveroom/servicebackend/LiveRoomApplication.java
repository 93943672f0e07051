package com.liveroom.servicebackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiveRoomApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveRoomApplication.class, args);
    }
}
