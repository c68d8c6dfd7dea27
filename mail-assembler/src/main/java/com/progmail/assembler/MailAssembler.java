package com.progmail.assembler;

import com.progmail.markup.BalanceChecker;
import com.progmail.markup.BalanceResult;
import com.progmail.markup.MarkupNode;
import com.progmail.markup.MarkupTree;
import com.progmail.template.AttributeTable;
import com.progmail.template.RenderResult;
import com.progmail.template.SelectionFilter;
import com.progmail.template.TemplateEngine;
import com.progmail.util.LoggingUtil;
import com.progmail.util.RunLog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;

/**
 * MailAssembler - builds the participant schedule email batch.
 *
 * Reads the schedule and participant reports produced by the program analyzer,
 * plus a user-written template, and writes one email message per selected
 * person to a single text file that can be reviewed before it is mailed.
 */
public class MailAssembler {

    private final AssemblerConfig config;
    private final Path workingDirectory;
    private final RunLog log;
    private final ProgramFileLocator locator;

    public MailAssembler(AssemblerConfig config, Path workingDirectory, RunLog log) {
        this.config = config;
        this.workingDirectory = workingDirectory;
        this.log = log;
        this.locator = new ProgramFileLocator(workingDirectory, log);
    }

    /**
     * Main entry point. Optional argument: the parameters file.
     */
    public static void main(String[] args) {
        ExitStatus status = run(args, Paths.get("").toAbsolutePath());
        System.exit(status.getCode());
    }

    /**
     * Load the parameters, assemble the batch and report accumulated errors.
     */
    public static ExitStatus run(String[] args, Path workingDirectory) {
        AssemblerConfig config = AssemblerConfig.withDefaults();
        String parametersFile = args.length > 0 ? args[0] : config.getParametersFile();
        Path parametersPath = workingDirectory.resolve(parametersFile);

        try {
            config.loadFromFile(parametersPath);
        } catch (IOException e) {
            LoggingUtil.error("Can't open/read " + parametersPath + ": " + e.getMessage());
            return ExitStatus.BAD_PARAMETERS;
        }

        LoggingUtil.initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(), config.getLogFileName());
        config.printDebug();

        RunLog log = new RunLog();
        try {
            new MailAssembler(config, workingDirectory, log).assemble();
        } catch (AssemblyException e) {
            LoggingUtil.error("MailAssembler terminated: " + e.getMessage());
            return e.getStatus();
        }
        log.displayErrorsIfAny();
        return ExitStatus.SUCCESS;
    }

    /**
     * Run the whole pipeline.
     *
     * @return the file written
     * @throws AssemblyException on any fatal condition; nothing is written then
     */
    public Path assemble() throws AssemblyException {
        // Schedules
        Path schedulePath = locator.require(config.getScheduleFile(), config.getReportsDirectory(), ".");
        String schedule = read(schedulePath).replace(">\n<", "><");
        checkBalance(schedule, schedulePath);
        MarkupNode main = new MarkupTree(log).parse(schedule);
        log.info("Read " + main.size() + " schedules from " + schedulePath);

        // Participant attributes
        Path participantsPath = locator.require(config.getParticipantsFile(), config.getReportsDirectory(), ".");
        AttributeTable attributes = AttributeTable.fromMarkup(read(participantsPath), log);

        // Template
        Path templatePath = locator.require(config.getTemplateFile(), ".", ".");
        String templateText = read(templatePath);
        checkBalance(templateText, templatePath);
        EmailTemplate template = new EmailTemplateParser(log).parse(templateText, config.getOutputFormat());

        SelectionFilter filter = new SelectionFilter(template.getSelection(), attributes, log);
        TemplateEngine engine = new TemplateEngine(attributes, log);
        EmailBatchWriter writer = new EmailBatchWriter(LocalDateTime.now());

        for (MarkupNode person : main.getChildren()) {
            if (!filter.evaluate(person).isSelected()) {
                continue;
            }
            String address = person.getText("email", "").trim();
            if (address.isEmpty()) {
                log.error("For " + person.getText("full name", "") + ", no email address -- skipped.");
                continue;
            }
            RenderResult rendered = engine.render(template.getBody(), person);
            if (!rendered.isRendered()) {
                throw new AssemblyException(ExitStatus.MISSING_COLUMN,
                        "Template column '" + rendered.getMissingColumn() + "' is not in " + participantsPath);
            }
            writer.addMessage(address, rendered.getText());
        }

        String outputName = template.getOutputFileName() != null
                ? template.getOutputFileName()
                : config.getOutputFile();
        Path outputPath = workingDirectory.resolve(outputName);
        try {
            writer.write(outputPath);
        } catch (IOException e) {
            throw new AssemblyException(ExitStatus.IO_FAILURE, "Can't write " + outputPath + ": " + e.getMessage(), e);
        }
        log.info("Wrote " + writer.getMessageCount() + " email messages to " + outputPath);
        return outputPath;
    }

    private void checkBalance(String document, Path source) throws AssemblyException {
        BalanceResult result = new BalanceChecker(log).check(document);
        if (!result.isBalanced()) {
            String message = "Markup error in " + source.getFileName() + ": " + result.describe();
            log.fatal(message);
            throw new AssemblyException(ExitStatus.UNBALANCED_MARKUP, message);
        }
    }

    private static String read(Path path) throws AssemblyException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8).replace("\r\n", "\n");
        } catch (IOException e) {
            throw new AssemblyException(ExitStatus.IO_FAILURE, "Can't read " + path + ": " + e.getMessage(), e);
        }
    }
}
