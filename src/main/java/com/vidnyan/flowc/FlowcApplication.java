package com.vidnyan.flowc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * flowc - compiles visual LLM flow graphs into LangChain source code.
 */
@SpringBootApplication
public class FlowcApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowcApplication.class, args);
    }
}
