package com.gdin.inspection.originality;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OriginalityApplication {

    public static void main(String[] args) {
        SpringApplication.run(OriginalityApplication.class, args);
    }
}
