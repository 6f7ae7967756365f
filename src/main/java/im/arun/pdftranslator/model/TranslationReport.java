package im.arun.pdftranslator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Summary of a run, written as JSON next to the translated text.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TranslationReport {

    @JsonProperty("doc_name")
    private String docName;

    @JsonProperty("page_count")
    private int pageCount;

    @JsonProperty("ocr_pages")
    private List<Integer> ocrPages;

    @JsonProperty("failed_pages")
    private List<Integer> failedPages;

    @JsonProperty("chunk_count")
    private Integer chunkCount;

    @JsonProperty("source_characters")
    private int sourceCharacters;

    @JsonProperty("translated_characters")
    private Integer translatedCharacters;

    @JsonProperty("target_language")
    private String targetLanguage;

    @JsonProperty("elapsed_ms")
    private long elapsedMillis;

    public static TranslationReport of(String docName, ExtractedDocument document) {
        TranslationReport report = new TranslationReport();
        report.setDocName(docName);
        report.setPageCount(document.getPageCount());
        report.setOcrPages(document.getOcrPageNumbers());
        report.setFailedPages(document.getFailedPageNumbers());
        report.setSourceCharacters(document.getText().length());
        return report;
    }

    public static TranslationReport of(String docName, TranslationResult result) {
        TranslationReport report = of(docName, result.getDocument());
        report.setChunkCount(result.getChunks().size());
        report.setTranslatedCharacters(result.getTranslatedText().length());
        report.setTargetLanguage(result.getTargetLanguage());
        return report;
    }
}
