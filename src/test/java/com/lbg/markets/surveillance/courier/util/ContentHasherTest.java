package com.lbg.markets.surveillance.courier.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContentHasherTest {

    @TempDir
    Path dir;

    @Test
    void shouldProduceLowercaseSha256Hex() throws IOException {
        Path file = Files.writeString(dir.resolve("abc.txt"), "abc");

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                ContentHasher.hash(file));
    }

    @Test
    void shouldHashEmptyFile() throws IOException {
        Path file = Files.createFile(dir.resolve("empty"));

        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                ContentHasher.hash(file));
    }

    @Test
    void shouldDependOnContentOnly() throws IOException {
        byte[] content = TestFiles.randomBytes(100_000, 7);
        Path a = TestFiles.write(dir.resolve("a.bin"), content);
        Path b = TestFiles.write(dir.resolve("nested/b.dat"), content);
        Path c = TestFiles.write(dir.resolve("c.bin"), TestFiles.randomBytes(100_000, 8));

        assertEquals(ContentHasher.hash(a), ContentHasher.hash(b));
        assertNotEquals(ContentHasher.hash(a), ContentHasher.hash(c));
    }

    @Test
    void shouldFailForMissingFile() {
        assertThrows(IOException.class, () -> ContentHasher.hash(dir.resolve("missing")));
    }
}
