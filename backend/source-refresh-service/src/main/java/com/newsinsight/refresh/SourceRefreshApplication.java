package com.newsinsight.refresh;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SourceRefreshApplication {

    public static void main(String[] args) {
        SpringApplication.run(SourceRefreshApplication.class, args);
    }
}
