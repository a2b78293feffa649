package com.slb.update_backend;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.slb.update_backend")
@MapperScan("com.slb.update_backend.modules.*.mapper")
public class UpdateBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(UpdateBackendApplication.class, args);
	}

}
