package com.sheetcalc.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetCalcApplication.class, args);
    }
}
