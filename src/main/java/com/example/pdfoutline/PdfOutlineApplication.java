package com.example.pdfoutline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfOutlineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfOutlineApplication.class, args);
    }
}
