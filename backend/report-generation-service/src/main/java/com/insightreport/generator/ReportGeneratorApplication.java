package com.insightreport.generator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Insight Report Generator Application
 *
 * Spring Boot 기반의 보고서 생성 서비스
 * - 구조화/비구조화 입력 데이터 프로파일링 및 차트 제안
 * - LLM 을 이용한 인사이트 본문 생성
 * - HTML, PDF, DOCX 보고서 출력
 * - 체크포인트 기반의 파이프라인 복구
 */
@SpringBootApplication
public class ReportGeneratorApplication {

    public static void main(String[] args) {
        // JFreeChart 렌더링은 디스플레이 없이 수행한다
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(ReportGeneratorApplication.class, args);
    }
}
