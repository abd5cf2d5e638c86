package com.itsm.watchtower.app;

import com.itsm.watchtower.WatchtowerConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(WatchtowerConfiguration.class)
public class WatchtowerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatchtowerApplication.class, args);
    }
}
