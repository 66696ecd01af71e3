package com.xksgroup.vodpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VodPipelineApplication {
    public static void main(String[] args) {
        SpringApplication.run(VodPipelineApplication.class, args);
    }
}
