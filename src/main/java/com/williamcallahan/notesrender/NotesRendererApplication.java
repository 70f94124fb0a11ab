package com.williamcallahan.notesrender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NotesRendererApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotesRendererApplication.class, args);
    }

}
