package com.waterresources.streamnet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StreamNetApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamNetApplication.class, args);
    }
}
