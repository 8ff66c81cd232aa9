package com.yunhwan.amqp.contract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AmqpContractWorkerApplication {

	public static void main(String[] args) {
		SpringApplication.run(AmqpContractWorkerApplication.class, args);
	}

}
