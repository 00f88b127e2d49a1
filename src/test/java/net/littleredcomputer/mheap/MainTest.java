package net.littleredcomputer.mheap;

import com.google.common.base.Splitter;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static List<String> run(String input, String... args) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name())) {
            Main.run(Main.parse(args), new StringReader(input), out);
        }
        return Splitter.on(System.lineSeparator()).omitEmptyStrings().splitToList(bytes.toString(StandardCharsets.UTF_8.name()));
    }

    @Test
    public void sortDescending() throws Exception {
        assertThat(run("3 15 1\n42\n\n", "-task", "sort"), contains("42", "15", "3", "1"));
    }

    @Test
    public void sortAscending() throws Exception {
        assertThat(run("3 15 1\n-42", "-task", "sort", "-order", "min"), contains("-42", "1", "3", "15"));
    }

    @Test
    public void top() throws Exception {
        assertThat(run("5 9 2 7 7", "-task", "top", "-k", "3"), contains("9", "7", "7"));
        assertThat(run("5 9", "-task", "top", "-k", "10", "-order", "min"), contains("5", "9"));
        assertThat(run("5 9", "-task", "top", "-k", "0"), is(empty()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingTask() throws Exception {
        run("1 2 3");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownTask() throws Exception {
        run("1 2 3", "-task", "shuffle");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownOrder() throws Exception {
        run("1 2 3", "-task", "sort", "-order", "sideways");
    }

    @Test(expected = NumberFormatException.class)
    public void badNumber() throws Exception {
        run("1 two 3", "-task", "sort");
    }

    @Test
    public void inputFileIsUtf8() throws Exception {
        // U+2003 is whitespace to the splitter, but only if its three bytes decode as one char.
        File f = folder.newFile("numbers.txt");
        Files.write(f.toPath(), "3\u20037\n1".getBytes(StandardCharsets.UTF_8));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (Reader in = Main.input(Main.parse("-task", "sort", "-input", f.getPath()));
             PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name())) {
            Main.run(Main.parse("-task", "sort"), in, out);
        }
        assertThat(Splitter.on(System.lineSeparator()).omitEmptyStrings().splitToList(bytes.toString(StandardCharsets.UTF_8.name())),
                contains("7", "3", "1"));
    }
}
