package com.demo.loanmodel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LoanModelExportApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanModelExportApplication.class, args);
    }
}
