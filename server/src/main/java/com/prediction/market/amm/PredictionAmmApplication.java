package com.prediction.market.amm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PredictionAmmApplication {

	public static void main(String[] args) {
		SpringApplication.run(PredictionAmmApplication.class, args);
	}

}
