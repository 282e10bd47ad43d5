package com.careinsight.careinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CareInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareInsightApplication.class, args);
    }
}
