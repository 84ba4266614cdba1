package com.tencent.jobdef;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Jobdef Application Entry Point
 *
 * @author jobdef
 */
@SpringBootApplication(scanBasePackages = "com.tencent.jobdef")
public class JobdefApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobdefApplication.class, args);
    }
}
