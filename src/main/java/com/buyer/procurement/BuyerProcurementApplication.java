package com.buyer.procurement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BuyerProcurementApplication {

	public static void main(String[] args) {
		SpringApplication.run(BuyerProcurementApplication.class, args);
	}

}
