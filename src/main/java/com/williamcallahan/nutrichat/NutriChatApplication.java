package com.williamcallahan.nutrichat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NutriChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(NutriChatApplication.class, args);
    }

}
