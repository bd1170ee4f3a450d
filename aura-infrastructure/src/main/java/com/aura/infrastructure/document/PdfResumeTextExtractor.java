package com.aura.infrastructure.document;

import com.aura.domain.screening.adapter.gateway.IResumeTextExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 基于 PDFBox 的简历文本抽取。抽取失败返回空字符串，由上层决定是否拒绝。
 */
@Slf4j
@Component
public class PdfResumeTextExtractor implements IResumeTextExtractor {

    @Override
    public String extractText(Path documentPath) {
        if (documentPath == null || !Files.isRegularFile(documentPath)) {
            log.warn("Resume document not found. path={}", documentPath);
            return "";
        }
        try (PDDocument document = Loader.loadPDF(documentPath.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(document);
            return text == null ? "" : text;
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to extract resume text. path={}, error={}", documentPath, ex.getMessage());
            return "";
        }
    }
}
