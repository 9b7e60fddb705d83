package com.example.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SearchAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SearchAggregatorApplication.class, args);
    }

}
