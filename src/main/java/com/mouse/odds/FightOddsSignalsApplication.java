package com.mouse.odds;

import com.mouse.odds.config.IngestionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(IngestionProperties.class)
public class FightOddsSignalsApplication {

	public static void main(String[] args) {
		SpringApplication.run(FightOddsSignalsApplication.class, args);
	}

}
