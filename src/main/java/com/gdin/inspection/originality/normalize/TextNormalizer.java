package com.gdin.inspection.originality.normalize;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.originality.exception.UpstreamInputException;
import com.gdin.inspection.originality.models.ContentKind;
import com.gdin.inspection.originality.models.ContentUnit;
import com.gdin.inspection.originality.models.ExtractedFile;
import com.gdin.inspection.originality.models.Submission;
import com.gdin.inspection.originality.models.SubmissionInput;
import com.gdin.inspection.originality.models.UnanalyzableUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 文本规范化：比对前统一大小写、换行与空白
 */
@Slf4j
@Component
public class TextNormalizer {

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("\\p{P}+");

    /** # 开头但属于 C 预处理指令的行不当作注释 */
    private static final Set<String> PREPROCESSOR_DIRECTIVES = Set.of(
            "include", "define", "undef", "if", "ifdef", "ifndef", "elif", "else", "endif",
            "pragma", "error", "warning", "line");

    /**
     * NFKC、换行统一为 \n、转小写、空白压缩为单个空格、去首尾空白
     */
    public String normalize(String raw) {
        if (raw == null) return "";
        String text = Normalizer.normalize(raw, Normalizer.Form.NFKC);
        text = LINE_BREAKS.matcher(text).replaceAll("\n");
        text = text.toLowerCase(Locale.ROOT);
        text = WHITESPACE.matcher(text).replaceAll(" ");
        return text.trim();
    }

    /**
     * 比对用文本：代码去注释，其他文本去标点，然后 normalize
     */
    public String stripForComparison(String raw, ContentKind kind) {
        if (raw == null) return "";
        String stripped = kind == ContentKind.CODE
                ? stripComments(LINE_BREAKS.matcher(raw).replaceAll("\n"))
                : PUNCTUATION.matcher(raw).replaceAll(" ");
        return normalize(stripped);
    }

    public ContentUnit toContentUnit(int index, ExtractedFile file) {
        if (file == null) throw new UpstreamInputException("unit " + index + " is missing");
        String raw = file.getExtractedText();
        String normalized = normalize(raw);
        if (normalized.isEmpty()) {
            throw new UpstreamInputException("unit " + index + " (" + file.getFileName() + ") has no usable text");
        }
        return ContentUnit.builder()
                .index(index)
                .fileName(file.getFileName())
                .rawText(raw)
                .normalizedText(normalized)
                .contentKind(file.getContentKind() == null ? ContentKind.UNKNOWN : file.getContentKind())
                .build();
    }

    /**
     * 组装提交；不可用的单元不抛出，记录到 unanalyzableUnits
     */
    public AssembledSubmission assemble(SubmissionInput input) {
        List<ContentUnit> units = new ArrayList<>();
        List<UnanalyzableUnit> unanalyzable = new ArrayList<>();
        List<ExtractedFile> files = input.getFiles() == null ? List.of() : input.getFiles();

        for (int i = 0; i < files.size(); i++) {
            try {
                units.add(toContentUnit(i, files.get(i)));
            } catch (UpstreamInputException e) {
                ExtractedFile file = files.get(i);
                String ref = file == null || file.getFileName() == null ? "unit-" + i : file.getFileName();
                log.warn("跳过不可分析的单元 {}: {}", ref, e.getMessage());
                unanalyzable.add(UnanalyzableUnit.builder().unit(ref).reason(e.getMessage()).build());
            }
        }

        Submission submission = Submission.builder()
                .id(input.getSubmissionId())
                .authorId(input.getAuthorId())
                .units(CollectionUtil.isEmpty(units) ? List.of() : List.copyOf(units))
                .createdAt(input.getCreatedAt() == null ? Instant.now() : input.getCreatedAt())
                .build();
        return new AssembledSubmission(submission, List.copyOf(unanalyzable));
    }

    /**
     * 去掉 //、#、块注释和三引号文档字符串，字符串字面量内部不处理
     */
    String stripComments(String code) {
        StringBuilder out = new StringBuilder(code.length());
        int n = code.length();
        int i = 0;
        while (i < n) {
            char c = code.charAt(i);

            if (code.startsWith("\"\"\"", i) || code.startsWith("'''", i)) {
                String quote = code.substring(i, i + 3);
                int end = code.indexOf(quote, i + 3);
                i = end < 0 ? n : end + 3;
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                int end = skipString(code, i);
                out.append(code, i, end);
                i = end;
                continue;
            }
            if (code.startsWith("//", i)) {
                i = lineEnd(code, i);
                continue;
            }
            if (code.startsWith("/*", i)) {
                int end = code.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
                out.append(' ');
                continue;
            }
            if (c == '#' && !isPreprocessorDirective(code, i)) {
                i = lineEnd(code, i);
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static int skipString(String code, int start) {
        char quote = code.charAt(start);
        int i = start + 1;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            // 普通字符串不跨行
            if (c == '\n' && quote != '`') return i;
            i++;
        }
        return code.length();
    }

    private static int lineEnd(String code, int from) {
        int end = code.indexOf('\n', from);
        return end < 0 ? code.length() : end;
    }

    private boolean isPreprocessorDirective(String code, int hashIndex) {
        int lineStart = code.lastIndexOf('\n', hashIndex - 1) + 1;
        if (StrUtil.isNotBlank(code.substring(lineStart, hashIndex))) return false;
        // 指令名紧跟在 # 后面，"# if ..." 这种按注释处理
        int i = hashIndex + 1;
        int j = i;
        while (j < code.length() && Character.isLetter(code.charAt(j))) j++;
        return PREPROCESSOR_DIRECTIVES.contains(code.substring(i, j));
    }
}
