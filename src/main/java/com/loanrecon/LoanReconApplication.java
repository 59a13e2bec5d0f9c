package com.loanrecon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LoanReconApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanReconApplication.class, args);
    }
}
