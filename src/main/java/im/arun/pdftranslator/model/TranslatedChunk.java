package im.arun.pdftranslator.model;

import lombok.Value;

@Value
public class TranslatedChunk {
    int index;
    String text;
}
