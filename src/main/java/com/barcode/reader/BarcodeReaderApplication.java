package com.barcode.reader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BarcodeReaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(BarcodeReaderApplication.class, args);
    }
}
