package com.notice.evaluation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NoticeEvaluationApplication {

    public static void main(String[] args) {
        SpringApplication.run(NoticeEvaluationApplication.class, args);
    }
}
