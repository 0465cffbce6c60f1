package com.notice.evaluation.config;

import com.notice.evaluation.repository.NoticeWorkbookStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(EvaluationProperties.class)
@Slf4j
public class WorkbookConfig {

    @Bean
    public NoticeWorkbookStore noticeWorkbookStore(EvaluationProperties properties) {
        Path path = Path.of(properties.getWorkbookPath()).toAbsolutePath();
        log.info("Evaluation workbook: {} (master sheet '{}')", path, properties.getMasterSheet());
        return new NoticeWorkbookStore(path, properties.getMasterSheet());
    }

    // Master and model sheets exist with their headers before the first request
    @Bean
    public ApplicationRunner workbookInitializer(NoticeWorkbookStore store) {
        return args -> store.ensureWorkbook();
    }
}
