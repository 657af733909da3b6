package com.enterprise.taskrouting.store;

import com.enterprise.taskrouting.core.Source;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TaskIdGeneratorTest {

    @Test
    void testGeneratedIdFormat() {
        TaskIdGenerator generator = new TaskIdGenerator(ZoneOffset.UTC);

        String id = generator.generate(Instant.parse("2026-03-01T10:15:30Z"), Source.GMAIL);

        assertTrue(id.matches("20260301_101530_gmail_[0-9a-f]{6}"), id);
        assertTrue(TaskIdGenerator.isValidId(id));
    }

    @Test
    void testIdsFromSameSecondDiffer() {
        TaskIdGenerator generator = new TaskIdGenerator(ZoneOffset.UTC);
        Instant now = Instant.parse("2026-03-01T10:15:30Z");

        assertNotEquals(generator.generate(now, Source.INBOX), generator.generate(now, Source.INBOX));
    }

    @Test
    void testFileNameRoundTrip() {
        String fileName = TaskIdGenerator.fileName("20260301_101530_gmail_abcdef", "Launch Post: Spring!");

        assertEquals("20260301_101530_gmail_abcdef--launch_post_spring.md", fileName);
        assertEquals("20260301_101530_gmail_abcdef", TaskIdGenerator.idFromFileName(fileName));
        assertEquals("20260301_101530_gmail_abcdef.md", TaskIdGenerator.fileName("20260301_101530_gmail_abcdef", "  "));
    }

    @Test
    void testIdFromFileNameIgnoresStagingFiles() {
        assertNull(TaskIdGenerator.idFromFileName(".abc--title.md.pending"));
        assertNull(TaskIdGenerator.idFromFileName(".abc.md"));
        assertNull(TaskIdGenerator.idFromFileName("notes.txt"));
    }

    @Test
    void testInvalidIds() {
        assertFalse(TaskIdGenerator.isValidId(null));
        assertFalse(TaskIdGenerator.isValidId(""));
        assertFalse(TaskIdGenerator.isValidId("../escape"));
        assertFalse(TaskIdGenerator.isValidId("with space"));
        assertFalse(TaskIdGenerator.isValidId("double--dash"));
    }

    @Test
    void testSlugIsTruncated() {
        String slug = TaskIdGenerator.slug("word ".repeat(30));

        assertTrue(slug.length() <= 48);
        assertFalse(slug.endsWith("_"));
    }
}
