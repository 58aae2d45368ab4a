package com.peptide_toxicity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PeptideToxicityApplication {

	public static void main(String[] args) throws IOException {
		// sqlite-jdbc does not create missing parent directories for the database file
		Files.createDirectories(Paths.get(System.getenv().getOrDefault("DB_DIR", "data")));
		SpringApplication.run(PeptideToxicityApplication.class, args);
	}
}
