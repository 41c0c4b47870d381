package com.insightreport.generator;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * 스프링 컨텍스트 로드 테스트
 * 애플리케이션 설정이 올바르게 구성되었는지 확인합니다.
 */
@SpringBootTest
@ActiveProfiles("test")
class ReportGeneratorApplicationTests {

    @Test
    void contextLoads() {
        // 스프링 컨텍스트가 정상적으로 로드되면 테스트 통과
    }
}
