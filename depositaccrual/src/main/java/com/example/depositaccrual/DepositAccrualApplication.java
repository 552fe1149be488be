package com.example.depositaccrual;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DepositAccrualApplication {

    public static void main(String[] args) {
        SpringApplication.run(DepositAccrualApplication.class, args);
    }
}
