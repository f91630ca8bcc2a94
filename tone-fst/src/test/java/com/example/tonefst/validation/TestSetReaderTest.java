package com.example.tonefst.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestSetReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsFormAndSegmentationColumnsInAnyOrder() throws IOException {
        String csv = String.join("\n",
                "id,Segmentation,gloss,FORM",
                "1,ni3jo14##3>1>4##14>14,eat,ni{3>1>4}jo14",
                "2,,drink,ka4",
                "",
                "3,\"ka4##4\",\"to go, away\",ka4");

        List<TestCase> cases = TestSetReader.read(new StringReader(csv));

        assertEquals(List.of(
                new TestCase("ni{3>1>4}jo14", "ni3jo14##3>1>4##14>14"),
                new TestCase("ka4", "ka4##4")), cases);
    }

    @Test
    void byteOrderMarkIsIgnored() throws IOException {
        Path file = tempDir.resolve("tests.csv");
        Files.writeString(file, "\uFEFFform,segmentation\nka4,ka4\n", StandardCharsets.UTF_8);

        assertEquals(List.of(new TestCase("ka4", "ka4")), TestSetReader.read(file));
    }

    @Test
    void missingColumnIsRejected() {
        TestSetException ex = assertThrows(TestSetException.class,
                () -> TestSetReader.read(new StringReader("form,gloss\nka4,go\n")));
        assertTrue(ex.getMessage().contains("segmentation"));
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(TestSetException.class, () -> TestSetReader.read(new StringReader("")));
    }

    @Test
    void segmentationWithoutFormIsRejected() {
        assertThrows(TestSetException.class,
                () -> TestSetReader.read(new StringReader("form,segmentation\n,ka4\n")));
    }

    @Test
    void quotedFieldsKeepCommasAndQuotes() {
        assertEquals(List.of("a,b", "say \"x\"", ""), TestSetReader.splitRow("\"a,b\",\"say \"\"x\"\"\",", 1));
        assertThrows(TestSetException.class, () -> TestSetReader.splitRow("\"open", 4));
    }
}
