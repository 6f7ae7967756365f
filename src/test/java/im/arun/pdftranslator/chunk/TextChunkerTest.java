package im.arun.pdftranslator.chunk;

import im.arun.pdftranslator.model.TextChunk;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TextChunkerTest {

    private final TextChunker chunker = new TextChunker();

    @Test
    void emptyInputYieldsNoChunks() {
        assertTrue(chunker.chunk("", 4500).isEmpty());
        assertTrue(chunker.chunk(null, 4500).isEmpty());
        assertTrue(chunker.chunk("\n\n   \n\n", 4500).isEmpty());
    }

    @Test
    void packsParagraphsGreedily() {
        String p1 = "a".repeat(2000);
        String p2 = "b".repeat(3000);
        String p3 = "c".repeat(1000);

        List<TextChunk> chunks = chunker.chunk(p1 + "\n\n" + p2 + "\n\n" + p3, 4500);

        assertEquals(2, chunks.size());
        assertEquals(p1, chunks.get(0).getText());
        assertEquals(p2 + "\n\n" + p3, chunks.get(1).getText());
        assertEquals(4002, chunks.get(1).length());
        assertFalse(chunks.get(0).isHardSplit());
        assertFalse(chunks.get(1).isHardSplit());
    }

    @Test
    void hardSplitsOversizedParagraph() {
        String paragraph = "0123456789".repeat(1000);

        List<TextChunk> chunks = chunker.chunk(paragraph, 4500);

        assertEquals(3, chunks.size());
        assertEquals(4500, chunks.get(0).length());
        assertEquals(4500, chunks.get(1).length());
        assertEquals(1000, chunks.get(2).length());
        assertTrue(chunks.stream().allMatch(TextChunk::isHardSplit));

        StringBuilder rebuilt = new StringBuilder();
        chunks.forEach(chunk -> rebuilt.append(chunk.getText()));
        assertEquals(paragraph, rebuilt.toString());
    }

    @Test
    void oversizedParagraphFlushesPendingBuffer() {
        String text = "short\n\n" + "x".repeat(20) + "\n\ntail";

        List<TextChunk> chunks = chunker.chunk(text, 10);

        assertEquals(List.of("short", "x".repeat(10), "x".repeat(10), "tail"),
                chunks.stream().map(TextChunk::getText).collect(Collectors.toList()));
        assertFalse(chunks.get(0).isHardSplit());
        assertTrue(chunks.get(1).isHardSplit());
        assertTrue(chunks.get(2).isHardSplit());
        assertFalse(chunks.get(3).isHardSplit());
    }

    @Test
    void trimsParagraphsAndDropsBlankOnes() {
        List<TextChunk> chunks = chunker.chunk("  first  \n\n\n\n   \n\nsecond\n\n", 100);

        assertEquals(1, chunks.size());
        assertEquals("first\n\nsecond", chunks.get(0).getText());
    }

    @Test
    void separatorCountsTowardsTheLimit() {
        // 5 + 2 + 2 == 9 fits exactly, one more char does not
        assertEquals(1, chunker.chunk("abcde\n\nfg", 9).size());

        List<TextChunk> chunks = chunker.chunk("abcde\n\nfgh", 9);
        assertEquals(List.of("abcde", "fgh"), chunks.stream().map(TextChunk::getText).collect(Collectors.toList()));
    }

    @Test
    void paragraphOfExactlyMaxLenIsNotSplit() {
        List<TextChunk> chunks = chunker.chunk("abcde", 5);

        assertEquals(1, chunks.size());
        assertFalse(chunks.get(0).isHardSplit());
    }

    @Test
    void chunkIndexesFollowOutputOrder() {
        List<TextChunk> chunks = chunker.chunk("one\n\n" + "y".repeat(25) + "\n\ntwo", 10);

        for (int i = 0; i < chunks.size(); i++) {
            assertEquals(i, chunks.get(i).getIndex());
        }
    }

    @Test
    void hardSplitKeepsSurrogatePairsTogether() {
        String paragraph = "ab😀cd";

        List<TextChunk> chunks = chunker.chunk(paragraph, 3);

        StringBuilder rebuilt = new StringBuilder();
        for (TextChunk chunk : chunks) {
            assertTrue(chunk.length() <= 3);
            assertFalse(Character.isHighSurrogate(chunk.getText().charAt(chunk.length() - 1)));
            rebuilt.append(chunk.getText());
        }
        assertEquals(paragraph, rebuilt.toString());
    }

    @Test
    void rejectsNonPositiveMaxLen() {
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk("text", 0));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk("text", -1));
    }

    @Test
    void randomTextRespectsBoundAndKeepsEveryParagraphInOrder() {
        Random random = new Random(42);

        for (int round = 0; round < 200; round++) {
            int maxLen = 20 + random.nextInt(480);
            List<String> paragraphs = new ArrayList<>();
            StringBuilder input = new StringBuilder();

            int count = random.nextInt(30);
            for (int i = 0; i < count; i++) {
                String paragraph = randomParagraph(random, random.nextInt(3 * maxLen));
                if (i > 0) {
                    input.append(random.nextBoolean() ? "\n\n" : "\n\n\n\n");
                }
                input.append(random.nextInt(4) == 0 ? "  " + paragraph + " " : paragraph);
                if (!paragraph.isBlank()) {
                    paragraphs.add(paragraph.strip());
                }
            }

            List<TextChunk> chunks = chunker.chunk(input.toString(), maxLen);

            chunks.forEach(chunk -> assertTrue(chunk.length() <= maxLen,
                    "chunk of " + chunk.length() + " exceeds " + maxLen));
            assertEquals(paragraphs, reassemble(chunks, paragraphs));
        }
    }

    private static List<String> reassemble(List<TextChunk> chunks, List<String> expected) {
        List<String> rebuilt = new ArrayList<>();
        int i = 0;
        while (i < chunks.size()) {
            TextChunk chunk = chunks.get(i);
            if (!chunk.isHardSplit()) {
                for (String part : chunk.getText().split("\n\n")) {
                    rebuilt.add(part);
                }
                i++;
                continue;
            }
            // slices of one oversized paragraph are consecutive
            int targetLength = expected.get(rebuilt.size()).length();
            StringBuilder paragraph = new StringBuilder();
            while (paragraph.length() < targetLength) {
                paragraph.append(chunks.get(i++).getText());
            }
            rebuilt.add(paragraph.toString());
        }
        return rebuilt;
    }

    private static String randomParagraph(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(random.nextInt(6) == 0 ? ' ' : (char) ('a' + random.nextInt(26)));
        }
        return sb.toString();
    }
}
