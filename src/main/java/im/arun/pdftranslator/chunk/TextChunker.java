package im.arun.pdftranslator.chunk;

import im.arun.pdftranslator.model.TextChunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into chunks no longer than a maximum length, keeping paragraphs
 * (separated by a blank line) together wherever they fit.
 */
public class TextChunker {
    public static final String PARAGRAPH_SEPARATOR = "\n\n";

    /**
     * Greedily packs paragraphs into chunks of at most {@code maxLen} characters.
     * A paragraph longer than {@code maxLen} is emitted on its own, cut into
     * {@code maxLen}-sized slices.
     *
     * @param text   input text, may be null or empty
     * @param maxLen maximum chunk length in chars, must be positive
     * @return chunks in input order; empty for empty input
     */
    public List<TextChunk> chunk(String text, int maxLen) {
        if (maxLen <= 0) {
            throw new IllegalArgumentException("maxLen must be positive: " + maxLen);
        }
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        List<String> buffer = new ArrayList<>();
        int bufferLength = 0;

        for (String raw : text.split(PARAGRAPH_SEPARATOR)) {
            String paragraph = raw.strip();
            if (paragraph.isEmpty()) {
                continue;
            }

            if (paragraph.length() > maxLen) {
                if (!buffer.isEmpty()) {
                    chunks.add(new TextChunk(chunks.size(), String.join(PARAGRAPH_SEPARATOR, buffer), false));
                    buffer.clear();
                    bufferLength = 0;
                }
                hardSplit(paragraph, maxLen, chunks);
                continue;
            }

            int separator = buffer.isEmpty() ? 0 : PARAGRAPH_SEPARATOR.length();
            if (bufferLength + separator + paragraph.length() <= maxLen) {
                buffer.add(paragraph);
                bufferLength += separator + paragraph.length();
            } else {
                chunks.add(new TextChunk(chunks.size(), String.join(PARAGRAPH_SEPARATOR, buffer), false));
                buffer.clear();
                buffer.add(paragraph);
                bufferLength = paragraph.length();
            }
        }

        if (!buffer.isEmpty()) {
            chunks.add(new TextChunk(chunks.size(), String.join(PARAGRAPH_SEPARATOR, buffer), false));
        }
        return chunks;
    }

    private void hardSplit(String paragraph, int maxLen, List<TextChunk> chunks) {
        int start = 0;
        while (start < paragraph.length()) {
            int end = Math.min(start + maxLen, paragraph.length());
            // keep surrogate pairs together
            if (end < paragraph.length() && end - start > 1
                    && Character.isHighSurrogate(paragraph.charAt(end - 1))
                    && Character.isLowSurrogate(paragraph.charAt(end))) {
                end--;
            }
            chunks.add(new TextChunk(chunks.size(), paragraph.substring(start, end), true));
            start = end;
        }
    }
}
