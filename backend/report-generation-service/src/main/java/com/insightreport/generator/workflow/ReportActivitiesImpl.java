package com.insightreport.generator.workflow;

import com.insightreport.generator.config.PipelineProperties;
import com.insightreport.generator.dto.report.GeneratedChart;
import com.insightreport.generator.dto.report.GeneratedInsight;
import com.insightreport.generator.dto.report.GeneratedNarrative;
import com.insightreport.generator.dto.report.InputData;
import com.insightreport.generator.dto.report.ProfileResult;
import com.insightreport.generator.dto.report.RenderedDocument;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.dto.workflow.Heartbeat;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.entity.report.ReportFile;
import com.insightreport.generator.entity.report.ReportStatus;
import com.insightreport.generator.exception.ReportPipelineException;
import com.insightreport.generator.service.ai.NarrativeGenerator;
import com.insightreport.generator.service.ai.OpenAiNarrativeService;
import com.insightreport.generator.service.profile.DataProfiler;
import com.insightreport.generator.service.report.ChartGenerationService;
import com.insightreport.generator.service.report.DocumentRenderer;
import com.insightreport.generator.service.storage.ReportStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 보고서 생성 파이프라인의 activity 구현
 *
 * 각 메서드는 {@link ActivityExecutor} 를 통해 타임아웃/재시도와 함께 호출된다.
 */
@Service
@Slf4j
public class ReportActivitiesImpl implements ReportActivities {

    static final String COVER_ASSET_ID = "cover";

    private final DataProfiler dataProfiler;
    private final NarrativeGenerator narrativeGenerator;
    private final ChartGenerationService chartGenerationService;
    private final ReportStorage reportStorage;
    private final TaskScheduler heartbeatScheduler;
    private final PipelineProperties pipelineProperties;
    private final Map<OutputFormat, DocumentRenderer> renderers = new EnumMap<>(OutputFormat.class);

    public ReportActivitiesImpl(DataProfiler dataProfiler,
                                NarrativeGenerator narrativeGenerator,
                                ChartGenerationService chartGenerationService,
                                ReportStorage reportStorage,
                                List<DocumentRenderer> documentRenderers,
                                @Qualifier("heartbeatScheduler") TaskScheduler heartbeatScheduler,
                                PipelineProperties pipelineProperties) {
        this.dataProfiler = dataProfiler;
        this.narrativeGenerator = narrativeGenerator;
        this.chartGenerationService = chartGenerationService;
        this.reportStorage = reportStorage;
        this.heartbeatScheduler = heartbeatScheduler;
        this.pipelineProperties = pipelineProperties;
        documentRenderers.forEach(renderer -> renderers.put(renderer.format(), renderer));
    }

    @Override
    public ProfileResult profileData(String reportId, List<InputData> inputData) {
        log.info("Profiling data: reportId={}, blocks={}", reportId, inputData.size());

        ProfileResult result = dataProfiler.profile(inputData);
        reportStorage.saveReport(reportId, Report.builder().dataProfile(result.getProfile()).build());

        log.info("Data profiled: reportId={}, rows={}, columns={}, qualityScore={}",
                reportId, result.getProfile().getRowCount(), result.getProfile().getColumnCount(),
                result.getProfile().getDataQualityScore());
        return result;
    }

    @Override
    public GeneratedNarrative generateInsights(String reportId, ProfileResult profile, ReportConfig config) {
        log.info("Generating insights: reportId={}, style={}", reportId, config.getStyle());

        GeneratedNarrative narrative = narrativeGenerator.generateNarrative(
                reportId,
                profile.getProfile(),
                profile.getRecords(),
                profile.getTextBlocks(),
                config.getStyle(),
                config.getTitle(),
                config.getCustomPromptInstructions());

        narrative.setSections(filterSections(narrative.getSections(),
                config.getSectionsToInclude(), config.getSectionsToExclude()));

        if (config.isGenerateCoverImage()) {
            narrative.setCoverImage(generateCoverImage(reportId, config));
        }

        log.info("Insights generated: reportId={}, sections={}, findings={}",
                reportId, narrative.getSections().size(), narrative.getKeyFindings().size());
        return narrative;
    }

    @Override
    public List<GeneratedChart> generateCharts(String reportId, ProfileResult profile) {
        DataProfile dataProfile = profile.getProfile();
        log.info("Generating charts: reportId={}, suggestions={}", reportId, dataProfile.getSuggestedCharts().size());

        List<GeneratedChart> charts = chartGenerationService.render(
                reportId, dataProfile.getSuggestedCharts(), profile.getRecords(), dataProfile);

        log.info("Charts generated: reportId={}, count={}", reportId, charts.size());
        return charts;
    }

    @Override
    public String renderLayout(String reportId, ReportConfig config, GeneratedNarrative narrative,
                               List<GeneratedChart> charts, DataProfile profile) {
        log.info("Rendering layout: reportId={}", reportId);

        Report report = currentReport(reportId, config);
        RenderedDocument html = rendererFor(OutputFormat.HTML).render(report, narrative, charts, profile);
        String location = reportStorage.saveOutputFile(reportId, OutputFormat.HTML.fileName(reportId), html.bytes());

        log.info("Layout rendered: reportId={}, size={}", reportId, html.size());
        return location;
    }

    @Override
    public List<ReportFile> exportFormats(ActivityContext context, String reportId, ReportConfig config,
                                          GeneratedNarrative narrative, List<GeneratedChart> charts, DataProfile profile) {
        List<OutputFormat> formats = List.copyOf(new LinkedHashSet<>(config.getOutputFormats()));
        int total = formats.size();
        AtomicInteger completed = new AtomicInteger();
        AtomicLong lastProgressNanos = new AtomicLong(System.nanoTime());
        long stallNanos = pipelineProperties.getHeartbeatTimeout().toNanos();

        log.info("Exporting formats: reportId={}, formats={}", reportId, formats);

        // 마지막 진행 이후 heartbeatTimeout 이 지나면 주기 하트비트를 멈춘다
        ScheduledFuture<?> ticker = heartbeatScheduler.scheduleAtFixedRate(() -> {
            if (System.nanoTime() - lastProgressNanos.get() < stallNanos) {
                context.heartbeat(new Heartbeat(PipelineStep.EXPORT_FORMATS.getActivityName(), completed.get(), total));
            } else {
                log.debug("Export stalled, skipping heartbeat: reportId={}, completed={}/{}",
                        reportId, completed.get(), total);
            }
        }, pipelineProperties.getHeartbeatInterval());

        try {
            Report report = currentReport(reportId, config);
            List<ReportFile> files = new ArrayList<>();
            for (OutputFormat format : formats) {
                files.add(exportFormat(reportId, format, report, narrative, charts, profile));
                lastProgressNanos.set(System.nanoTime());
                context.heartbeat(new Heartbeat(PipelineStep.EXPORT_FORMATS.getActivityName(), completed.incrementAndGet(), total));
            }
            log.info("Formats exported: reportId={}, files={}", reportId, files.size());
            return files;
        } finally {
            ticker.cancel(false);
        }
    }

    @Override
    public Report finalizeReport(String reportId, List<ReportFile> files, DataProfile profile) {
        PipelineStep step = PipelineStep.FINALIZE;
        Report saved = reportStorage.saveReport(reportId, Report.builder()
                .status(step.getStatus())
                .progress(step.getProgress())
                .currentStep(step.getDescription())
                .completedAt(LocalDateTime.now())
                .files(files)
                .dataProfile(profile)
                .build());

        log.info("Report finalized: reportId={}, files={}", reportId, files.size());
        return saved;
    }

    @Override
    public void updateReportStatus(String reportId, ReportStatus status, int progress,
                                   String currentStep, String errorMessage) {
        Report stored = reportStorage.getReport(reportId).orElse(null);
        if (stored != null && stored.isTerminal()) {
            log.debug("Skipping status update of terminal report: reportId={}, stored={}, requested={}",
                    reportId, stored.getStatus(), status);
            return;
        }

        reportStorage.saveReport(reportId, Report.builder()
                .status(status)
                .progress(progress)
                .currentStep(currentStep)
                .errorMessage(errorMessage)
                .build());
    }

    private ReportFile exportFormat(String reportId, OutputFormat format, Report report,
                                    GeneratedNarrative narrative, List<GeneratedChart> charts, DataProfile profile) {
        String filename = format.fileName(reportId);
        long size;

        if (format == OutputFormat.HTML && reportStorage.fileExists(reportId, filename)) {
            size = reportStorage.getFileSize(reportId, filename);
        } else {
            RenderedDocument document = rendererFor(format).render(report, narrative, charts, profile);
            reportStorage.saveOutputFile(reportId, filename, document.bytes());
            size = document.size();
        }

        log.debug("Format exported: reportId={}, format={}, size={}", reportId, format, size);
        return ReportFile.builder()
                .format(format)
                .url("/api/v1/reports/" + reportId + "/files?format=" + format.getExtension())
                .size(size)
                .generatedAt(LocalDateTime.now())
                .build();
    }

    private byte[] generateCoverImage(String reportId, ReportConfig config) {
        try {
            byte[] image = narrativeGenerator.generateImage(reportId,
                    OpenAiNarrativeService.coverImagePrompt(config.getTitle(), config.getStyle()));
            reportStorage.saveChart(reportId, COVER_ASSET_ID, image);
            return image;
        } catch (ReportPipelineException e) {
            log.warn("Cover image generation failed, continuing without it: reportId={}, error={}",
                    reportId, e.getMessage());
            return null;
        }
    }

    private Report currentReport(String reportId, ReportConfig config) {
        return reportStorage.getReport(reportId).orElseGet(() -> Report.builder()
                .id(reportId)
                .title(config.getTitle())
                .style(config.getStyle())
                .branding(config.getBranding())
                .authorName(config.getAuthorName())
                .createdAt(LocalDateTime.now())
                .build());
    }

    private DocumentRenderer rendererFor(OutputFormat format) {
        DocumentRenderer renderer = renderers.get(format);
        if (renderer == null) {
            throw new ReportPipelineException("UNSUPPORTED_FORMAT", "No renderer for format " + format);
        }
        return renderer;
    }

    /**
     * sectionId 또는 제목(대소문자 무시)으로 섹션을 거른다. include 가 비어 있으면 전체 대상.
     */
    static List<GeneratedInsight> filterSections(List<GeneratedInsight> sections,
                                                 Collection<String> include, Collection<String> exclude) {
        Set<String> included = normalize(include);
        Set<String> excluded = normalize(exclude);
        return sections.stream()
                .filter(section -> included.isEmpty() || matches(section, included))
                .filter(section -> !matches(section, excluded))
                .collect(Collectors.toList());
    }

    private static boolean matches(GeneratedInsight section, Set<String> names) {
        return (section.getSectionId() != null && names.contains(section.getSectionId().toLowerCase(Locale.ROOT)))
                || (section.getSectionTitle() != null && names.contains(section.getSectionTitle().toLowerCase(Locale.ROOT)));
    }

    private static Set<String> normalize(Collection<String> names) {
        if (names == null) {
            return Set.of();
        }
        return names.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
