package com.cgi.piiscan.dbscanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.ComponentScan;

// Scanned databases get their own pools; the application has no datasource of its own
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ComponentScan(basePackages = {"com.cgi.piiscan.dbscanner", "com.cgi.piiscan.piidetector"})
public class PiiScanApplication {

	public static void main(String[] args) {
		SpringApplication.run(PiiScanApplication.class, args);
	}

}
