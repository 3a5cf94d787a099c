package br.com.fantasyflicks.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication
@EnableTransactionManagement
public class FantasyFlicksBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(FantasyFlicksBackendApplication.class, args);
    }
}
