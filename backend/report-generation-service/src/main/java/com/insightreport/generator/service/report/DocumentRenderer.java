package com.insightreport.generator.service.report;

import com.insightreport.generator.dto.report.GeneratedChart;
import com.insightreport.generator.dto.report.GeneratedNarrative;
import com.insightreport.generator.dto.report.RenderedDocument;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.Report;

import java.util.List;

/**
 * 출력 형식별 문서 렌더러
 */
public interface DocumentRenderer {

    OutputFormat format();

    RenderedDocument render(Report report, GeneratedNarrative narrative, List<GeneratedChart> charts, DataProfile profile);
}
