package im.arun.pdftranslator.model;

import lombok.Value;

/**
 * A length-bounded unit of text sent to the translator in one request.
 * {@code hardSplit} marks slices of a paragraph that alone exceeded the limit.
 */
@Value
public class TextChunk {
    int index;
    String text;
    boolean hardSplit;

    public int length() {
        return text.length();
    }
}
