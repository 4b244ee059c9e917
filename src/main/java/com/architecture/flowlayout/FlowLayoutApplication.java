package com.architecture.flowlayout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowLayoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowLayoutApplication.class, args);
    }
}
