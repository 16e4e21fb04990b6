package org.smileyface.campuscrawler;

import org.smileyface.campuscrawler.crawler.CrawlerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CrawlerProperties.class)
public class CampusCrawlerApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(CampusCrawlerApplication.class, args)));
	}
}
