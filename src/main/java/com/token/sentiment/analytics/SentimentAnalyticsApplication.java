package com.token.sentiment.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class SentimentAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(SentimentAnalyticsApplication.class, args);
	}

}
