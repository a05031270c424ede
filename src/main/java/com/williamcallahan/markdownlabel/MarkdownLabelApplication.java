package com.williamcallahan.markdownlabel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MarkdownLabelApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarkdownLabelApplication.class, args);
    }

}
