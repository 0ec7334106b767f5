package com.invoiceocr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author invoice-ocr
 * @since 2026-10-12
 */
@SpringBootApplication
public class InvoiceOcrApplication {

	public static void main(String[] args) {
		SpringApplication.run(InvoiceOcrApplication.class, args);
		System.out.println("===========================================================\n"+
		 "接口文档 UI (Swagger): " + "http://localhost:8080/swagger-ui.html\n"
		 + "===========================================================");

	}

}
