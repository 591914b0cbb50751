package com.example.datalake.kbscore;

import com.example.datalake.kbscore.config.ScoringProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ScoringProperties.class)
public class KbScoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(KbScoreApplication.class, args);
    }

}
