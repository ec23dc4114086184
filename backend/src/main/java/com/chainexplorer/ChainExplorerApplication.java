package com.chainexplorer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainExplorerApplication.class, args);
    }
}
