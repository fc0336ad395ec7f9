package com.example.sqlsentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SqlSentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlSentinelApplication.class, args);
    }

}
