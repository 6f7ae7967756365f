package im.arun.pdftranslator.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered per-page extraction results plus the page-marked text layout built from them.
 */
public final class ExtractedDocument {
    private static final String PAGE_MARKER = "\n\n===== Page %d =====\n";

    private final List<PageResult> pages;
    private final String text;

    public ExtractedDocument(List<PageResult> pages) {
        this.pages = pages == null ? List.of() : List.copyOf(pages);
        this.text = layout(this.pages);
    }

    public static ExtractedDocument empty() {
        return new ExtractedDocument(List.of());
    }

    /**
     * Each page becomes {@code "\n\n===== Page N =====\n" + text}; the concatenation is stripped as a whole.
     * Downstream consumers parse this layout, keep it verbatim.
     */
    private static String layout(List<PageResult> pages) {
        StringBuilder sb = new StringBuilder();
        for (PageResult page : pages) {
            sb.append(String.format(PAGE_MARKER, page.getPageNumber()));
            sb.append(page.getText().strip());
        }
        return sb.toString().strip();
    }

    public List<PageResult> getPages() {
        return pages;
    }

    public String getText() {
        return text;
    }

    public int getPageCount() {
        return pages.size();
    }

    /**
     * True when at least one page produced non-blank text. Page markers alone do not count.
     */
    public boolean hasText() {
        return pages.stream().anyMatch(page -> !page.getText().isBlank());
    }

    /**
     * True when the document has pages and none of them could be read.
     */
    public boolean allPagesFailed() {
        return !pages.isEmpty() && pages.stream().allMatch(PageResult::isFailed);
    }

    public Optional<PageResult> firstFailedPage() {
        return pages.stream().filter(PageResult::isFailed).findFirst();
    }

    public List<Integer> getOcrPageNumbers() {
        return pages.stream().filter(PageResult::isOcr).map(PageResult::getPageNumber).collect(Collectors.toList());
    }

    public List<Integer> getFailedPageNumbers() {
        return pages.stream().filter(PageResult::isFailed).map(PageResult::getPageNumber).collect(Collectors.toList());
    }
}
