package com.progmail.assembler;

import com.progmail.util.RunLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MailAssemblerTest {

    private static final String SCHEDULES =
            "<person>\n"
            + "<full name>Ann</full name>\n"
            + "<email>ann@x.com</email>\n"
            + "<item><title>Panel</title><participants>none</participants><precis>none</precis></item>\n"
            + "</person>\n"
            + "<person>\n"
            + "<full name>Bob</full name>\n"
            + "<email>bob@x.com</email>\n"
            + "<item><title>Reading</title><participants>Bob</participants><precis></precis></item>\n"
            + "</person>\n";

    private static final String PARTICIPANTS =
            "<person><full name>Ann</full name><track>Tech</track></person>\n"
            + "<person><full name>Bob</full name><track>Arts</track></person>\n";

    private static final String TEMPLATE =
            "<select><header>track</header><value>Tech</value></select>\n"
            + "<email body>Dear [[full name]],\n[[schedule]]</email body>\n";

    @TempDir
    Path tempDir;

    private AssemblerConfig config;
    private RunLog log;

    @BeforeEach
    public void setup() throws IOException {
        Files.createDirectories(tempDir.resolve("reports"));
        write("reports/Program participant schedules.xml", SCHEDULES);
        write("reports/Program participants.xml", PARTICIPANTS);
        write("Template.xml", TEMPLATE);

        config = new AssemblerConfig();
        config.setReportsDirectory("reports");
        log = new RunLog();
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    private String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Test
    public void testSelectedPersonGetsEmail() throws Exception {
        Path output = new MailAssembler(config, tempDir, log).assemble();

        assertEquals(tempDir.resolve("Program participant schedules email.txt"), output);
        String batch = read(output);
        assertTrue(batch.startsWith("# "));
        assertTrue(batch.contains("<email-message><email-address>ann@x.com</email-address>"
                + "<content>Dear Ann,\nPanel\n"));
        assertTrue(batch.contains("<content>Dear Ann,\nPanel\nnone\nnone\n\n\n</content></email-message>\n\n\n"));
        assertFalse(batch.contains("bob@x.com"));
        assertEquals(1, batch.split("<email-message>", -1).length - 1);
        assertFalse(log.hasErrors());
    }

    @Test
    public void testHtmlSchedule() throws Exception {
        config.setMailFormat("html");
        String batch = read(new MailAssembler(config, tempDir, log).assemble());
        assertTrue(batch.contains("<content>Dear Ann,\n<p>Panel</p>\n<p>none</p>\n<p>none</p>\n<p></p>\n\n</content>"));
    }

    @Test
    public void testPeopleMissingFromAttributesAreSkipped() throws Exception {
        write("reports/Program participants.xml", "<person><full name>Bob</full name><track>Tech</track></person>\n");
        String batch = read(new MailAssembler(config, tempDir, log).assemble());

        assertTrue(batch.contains("bob@x.com"));
        assertFalse(batch.contains("ann@x.com"));
        assertEquals(1, log.getErrors().size());
        assertTrue(log.getErrors().get(0).contains("Ann"));
    }

    @Test
    public void testPersonWithoutEmailIsSkipped() throws Exception {
        write("reports/Program participant schedules.xml", SCHEDULES
                + "<person>\n<full name>Cy</full name>\n"
                + "<item><title>Keynote</title><participants>Cy</participants><precis></precis></item>\n"
                + "</person>\n");
        write("reports/Program participants.xml", PARTICIPANTS
                + "<person><full name>Cy</full name><track>Tech</track></person>\n");

        String batch = read(new MailAssembler(config, tempDir, log).assemble());

        assertTrue(batch.contains("ann@x.com"));
        assertFalse(batch.contains("Keynote"));
        assertEquals(1, batch.split("<email-message>", -1).length - 1);
        assertEquals(1, log.getErrors().size());
        assertTrue(log.getErrors().get(0).contains("Cy"));
    }

    @Test
    public void testTemplateNamesOutputFile() throws Exception {
        write("Template.xml", TEMPLATE + "<inputFileName>custom email.txt</inputFileName>\n");
        Path output = new MailAssembler(config, tempDir, log).assemble();
        assertEquals(tempDir.resolve("custom email.txt"), output);
        assertFalse(Files.exists(tempDir.resolve("Program participant schedules email.txt")));
    }

    @Test
    public void testUnknownColumnWritesNothing() throws IOException {
        write("Template.xml", "<select><header>track</header><value>Tech</value></select>"
                + "<email body>Your size is [[shoe size]]</email body>");

        AssemblyException e = assertThrows(AssemblyException.class,
                () -> new MailAssembler(config, tempDir, log).assemble());
        assertEquals(ExitStatus.MISSING_COLUMN, e.getStatus());
        assertFalse(Files.exists(tempDir.resolve("Program participant schedules email.txt")));
    }

    @Test
    public void testUnbalancedScheduleIsFatal() throws IOException {
        write("reports/Program participant schedules.xml", SCHEDULES + "<person><full name>Cy</full name>");

        AssemblyException e = assertThrows(AssemblyException.class,
                () -> new MailAssembler(config, tempDir, log).assemble());
        assertEquals(ExitStatus.UNBALANCED_MARKUP, e.getStatus());
        assertFalse(Files.exists(tempDir.resolve("Program participant schedules email.txt")));
    }

    @Test
    public void testUnbalancedTemplateIsFatal() throws IOException {
        write("Template.xml", "<select><header>track</header><value>Tech</value></select>"
                + "<email body>Dear [[full name,</email body>");

        AssemblyException e = assertThrows(AssemblyException.class,
                () -> new MailAssembler(config, tempDir, log).assemble());
        assertEquals(ExitStatus.UNBALANCED_MARKUP, e.getStatus());
    }

    @Test
    public void testMissingInputFile() throws IOException {
        Files.delete(tempDir.resolve("reports/Program participants.xml"));

        AssemblyException e = assertThrows(AssemblyException.class,
                () -> new MailAssembler(config, tempDir, log).assemble());
        assertEquals(ExitStatus.MISSING_INPUT, e.getStatus());
    }

    @Test
    public void testRunWithParametersFile() throws IOException {
        write("parameters.txt", "ProgramAnalyzerReportsdir = reports\nPMATemplateFile = Template.xml\nMailFormat = text\n");

        assertEquals(ExitStatus.SUCCESS, MailAssembler.run(new String[0], tempDir));
        assertTrue(Files.exists(tempDir.resolve("Program participant schedules email.txt")));
    }

    @Test
    public void testRunExitStatuses() throws IOException {
        assertEquals(ExitStatus.BAD_PARAMETERS, MailAssembler.run(new String[] {"missing.txt"}, tempDir));

        write("other.txt", "ProgramAnalyzerReportsdir = nowhere\n");
        Files.delete(tempDir.resolve("reports/Program participant schedules.xml"));
        assertEquals(ExitStatus.MISSING_INPUT, MailAssembler.run(new String[] {"other.txt"}, tempDir));
    }
}
