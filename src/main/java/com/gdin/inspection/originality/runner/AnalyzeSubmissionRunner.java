package com.gdin.inspection.originality.runner;

import cn.hutool.core.io.FileUtil;
import com.gdin.inspection.originality.models.OriginalityReport;
import com.gdin.inspection.originality.models.SubmissionInput;
import com.gdin.inspection.originality.pipeline.OriginalityPipeline;
import com.gdin.inspection.originality.report.MarkdownReportRenderer;
import com.gdin.inspection.originality.util.IOUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 命令行入口：--input=submission.json [--output-dir=out]
 * 读取提取好的提交，输出 report JSON 与 Markdown。没有 --input 时什么也不做
 */
@Slf4j
@Component
public class AnalyzeSubmissionRunner implements ApplicationRunner {

    static final String OPTION_INPUT = "input";
    static final String OPTION_OUTPUT_DIR = "output-dir";

    @Resource
    private OriginalityPipeline originalityPipeline;

    @Resource
    private MarkdownReportRenderer markdownReportRenderer;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> inputs = args.getOptionValues(OPTION_INPUT);
        if (inputs == null || inputs.isEmpty()) {
            log.debug("未指定 --{}，跳过命令行分析", OPTION_INPUT);
            return;
        }

        File input = FileUtil.file(inputs.get(0));
        SubmissionInput submission;
        try (InputStream is = FileUtil.getInputStream(input)) {
            submission = IOUtil.jsonDeserialize(is, SubmissionInput.class);
        }

        OriginalityReport report = originalityPipeline.analyze(submission);

        List<String> outputs = args.getOptionValues(OPTION_OUTPUT_DIR);
        File outputDir = outputs == null || outputs.isEmpty()
                ? FileUtil.getParent(input.getAbsoluteFile(), 1)
                : FileUtil.mkdir(outputs.get(0));
        String baseName = "originality-" + report.getSubmissionId() + "-" + report.getReportId();

        File json = FileUtil.writeString(IOUtil.jsonSerialize(report, true),
                FileUtil.file(outputDir, baseName + ".json"), StandardCharsets.UTF_8);
        File markdown = FileUtil.writeString(markdownReportRenderer.render(report),
                FileUtil.file(outputDir, baseName + ".md"), StandardCharsets.UTF_8);
        log.info("报告已写出：{}，{}", json.getAbsolutePath(), markdown.getAbsolutePath());
    }
}
