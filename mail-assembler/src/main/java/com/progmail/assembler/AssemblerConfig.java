package com.progmail.assembler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.progmail.template.NormalizedKeyMap;
import com.progmail.template.OutputFormat;
import com.progmail.util.LoggingUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * AssemblerConfig - run settings for the mail assembler.
 *
 * Defaults come from {@code application.properties}; a parameters file then
 * overrides them. The parameters file is either JSON or the plain
 * {@code key = value} list written by hand next to the reports.
 */
public class AssemblerConfig {

    public static final String DEFAULTS_RESOURCE = "application.properties";

    // Keys of the key = value parameters file
    static final String PARM_REPORTS_DIR = "ProgramAnalyzerReportsdir";
    static final String PARM_TEMPLATE_FILE = "PMATemplateFile";
    static final String PARM_MAIL_FORMAT = "MailFormat";
    static final String PARM_OUTPUT_FILE = "OutputFile";
    static final String PARM_LOG_LEVEL = "LogLevel";
    static final String PARM_LOG_FILE = "LogFile";

    private String parametersFile = "parameters.txt";
    private String reportsDirectory = ".";
    private String mailFormat = "text";
    private String templateFile = "Template.xml";
    private String scheduleFile = "Program participant schedules.xml";
    private String participantsFile = "Program participants.xml";
    private String outputFile = "Program participant schedules email.txt";

    // Logging configuration
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private String logFileName = null;

    public AssemblerConfig() {
    }

    /**
     * Defaults from the classpath resource, or built-in defaults when it is missing.
     */
    public static AssemblerConfig withDefaults() {
        AssemblerConfig config = new AssemblerConfig();
        Properties defaults = new Properties();
        try (InputStream in = AssemblerConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                defaults.load(in);
            }
        } catch (IOException e) {
            LoggingUtil.warn("Error loading " + DEFAULTS_RESOURCE + ": " + e.getMessage());
        }
        config.applyDefaults(defaults);
        return config;
    }

    void applyDefaults(Properties defaults) {
        parametersFile = defaults.getProperty("parameters.filename", parametersFile);
        reportsDirectory = defaults.getProperty("reports.directory", reportsDirectory);
        mailFormat = defaults.getProperty("mail.format", mailFormat);
        templateFile = defaults.getProperty("template.filename", templateFile);
        scheduleFile = defaults.getProperty("schedule.filename", scheduleFile);
        participantsFile = defaults.getProperty("participants.filename", participantsFile);
        outputFile = defaults.getProperty("output.filename", outputFile);
        loggingLevel = defaults.getProperty("logging.level", loggingLevel);
        consoleLoggingEnabled = Boolean.parseBoolean(
                defaults.getProperty("logging.console", String.valueOf(consoleLoggingEnabled)));
    }

    /**
     * Override settings from a parameters file: JSON when the name ends in
     * {@code .json}, otherwise {@code key = value} lines.
     */
    public void loadFromFile(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Parameters file not found: " + path);
        }
        if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
            loadFromJson(path);
        } else {
            loadFromParameters(Files.readAllLines(path, StandardCharsets.UTF_8));
        }
    }

    void loadFromJson(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode configJson = mapper.readTree(path.toFile());
        if (configJson == null || !configJson.isObject()) {
            throw new IOException("Parameters file is not a JSON object: " + path);
        }

        if (configJson.has("reportsDirectory")) {
            reportsDirectory = configJson.get("reportsDirectory").asText();
        }
        if (configJson.has("mailFormat")) {
            mailFormat = configJson.get("mailFormat").asText();
        }
        if (configJson.has("templateFile")) {
            templateFile = configJson.get("templateFile").asText();
        }
        if (configJson.has("outputFile")) {
            outputFile = configJson.get("outputFile").asText();
        }

        if (configJson.has("input")) {
            JsonNode inputNode = configJson.get("input");
            if (inputNode.has("schedule")) {
                scheduleFile = inputNode.get("schedule").asText();
            }
            if (inputNode.has("participants")) {
                participantsFile = inputNode.get("participants").asText();
            }
        }

        if (configJson.has("logging")) {
            JsonNode loggingNode = configJson.get("logging");
            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }
            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }
            if (loggingNode.has("fileName")) {
                logFileName = loggingNode.get("fileName").asText();
            }
        }
    }

    /**
     * Parse {@code key = value} lines. Blank lines and lines starting with '#'
     * are ignored; keys are case- and whitespace-insensitive.
     */
    void loadFromParameters(List<String> lines) throws IOException {
        NormalizedKeyMap<String> parms = new NormalizedKeyMap<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                throw new IOException("Line " + lineNo + " of the parameters file is not 'key = value': " + raw);
            }
            parms.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
        }

        if (parms.isEmpty()) {
            throw new IOException("Parameters file is empty");
        }

        reportsDirectory = valueOr(parms, PARM_REPORTS_DIR, reportsDirectory);
        templateFile = valueOr(parms, PARM_TEMPLATE_FILE, templateFile);
        mailFormat = valueOr(parms, PARM_MAIL_FORMAT, mailFormat);
        outputFile = valueOr(parms, PARM_OUTPUT_FILE, outputFile);
        loggingLevel = valueOr(parms, PARM_LOG_LEVEL, loggingLevel);
        logFileName = valueOr(parms, PARM_LOG_FILE, logFileName);
    }

    private static String valueOr(NormalizedKeyMap<String> parms, String key, String fallback) {
        String value = parms.get(key);
        return value == null || value.isEmpty() ? fallback : value;
    }

    public OutputFormat getOutputFormat() {
        return OutputFormat.fromMailFormat(mailFormat);
    }

    public void printDebug() {
        LoggingUtil.debug("==== AssemblerConfig ====");
        LoggingUtil.debug("Reports Directory: " + reportsDirectory);
        LoggingUtil.debug("Mail Format: " + mailFormat + " (" + getOutputFormat() + ")");
        LoggingUtil.debug("Template File: " + templateFile);
        LoggingUtil.debug("Schedule File: " + scheduleFile);
        LoggingUtil.debug("Participants File: " + participantsFile);
        LoggingUtil.debug("Output File: " + outputFile);
        LoggingUtil.debug("Logging Level: " + loggingLevel);
        LoggingUtil.debug("Log File: " + (logFileName != null ? logFileName : "disabled"));
        LoggingUtil.debug("=========================");
    }

    // Getters and setters

    public String getParametersFile() {
        return parametersFile;
    }

    public String getReportsDirectory() {
        return reportsDirectory;
    }

    public void setReportsDirectory(String reportsDirectory) {
        this.reportsDirectory = reportsDirectory;
    }

    public void setMailFormat(String mailFormat) {
        this.mailFormat = mailFormat;
    }

    public String getTemplateFile() {
        return templateFile;
    }

    public String getScheduleFile() {
        return scheduleFile;
    }

    public String getParticipantsFile() {
        return participantsFile;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }
}
