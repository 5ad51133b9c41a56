package com.procureagent.negotiation;

import com.procureagent.common.web.ApiExceptionHandler;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(ApiExceptionHandler.class)
public class NegotiationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(NegotiationServiceApplication.class, args);
    }
}
