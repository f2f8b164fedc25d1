package com.example.invoiceverify;

import com.example.invoiceverify.config.InvoiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Application entry point for the invoice verification service.
 * Wires the extraction services, the artifact store and the HTTP endpoints under the interfaces layer.
 */
@SpringBootApplication
@EnableConfigurationProperties(InvoiceProperties.class)
public class InvoiceVerifyApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments, e.g. {@code --invoice.batch.run-on-startup=true}
	 */
	public static void main(String[] args) {
		SpringApplication.run(InvoiceVerifyApplication.class, args);
	}

}
