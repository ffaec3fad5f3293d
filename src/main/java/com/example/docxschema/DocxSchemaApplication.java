package com.example.docxschema;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocxSchemaApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocxSchemaApplication.class, args);
    }

}
