package com.mergington.activities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class ActivitiesApplication {

	private static final Logger logger = LoggerFactory.getLogger(ActivitiesApplication.class);

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(ActivitiesApplication.class);
		app.run(args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Activities API listening on port {}", event.getWebServer().getPort());
	}

}
