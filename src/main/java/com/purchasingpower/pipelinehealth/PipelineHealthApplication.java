package com.purchasingpower.pipelinehealth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PipelineHealthApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineHealthApplication.class, args);
    }
}
