package com.mikov.accountvalidator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccountValidatorApplication {

    public static void main(final String[] args) {
        SpringApplication.run(AccountValidatorApplication.class, args);
    }
}
