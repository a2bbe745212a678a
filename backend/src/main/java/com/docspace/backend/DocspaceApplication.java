package com.docspace.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocspaceApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC so token expiry and audit timestamps agree
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(DocspaceApplication.class, args);
	}

}
